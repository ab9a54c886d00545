package com.cadence.backend.repositories.campaign;

import com.cadence.backend.models.campaign.CampaignSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CampaignSettingsRepository extends JpaRepository<CampaignSettings, Long> {
}

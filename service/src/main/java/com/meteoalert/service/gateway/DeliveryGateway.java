package com.meteoalert.service.gateway;

import com.meteoalert.engine.export.AlertExportRecord;
import com.meteoalert.engine.export.VocabularyEntry;

import java.util.List;

/**
 * External system that receives generated alerts and forwards them to subscribers.
 */
public interface DeliveryGateway {
    void login();

    List<VocabularyEntry> fetchEvents();

    List<VocabularyEntry> fetchCities();

    /**
     * @return the raw response body of the batch import
     */
    String importAlerts(List<AlertExportRecord> alerts);

    void startDispatch();
}

package com.delta.signaltracker.ingest.persistence;

import com.delta.signaltracker.ingest.model.CompanyTarget;
import com.delta.signaltracker.ingest.model.ScoredRecord;

import java.util.List;

/**
 * Receives the accepted records of a run, once per run. The list may be empty.
 */
public interface ScoredRecordSink {

    /**
     * @throws RecordPersistenceException when the records could not be stored
     */
    void save(CompanyTarget target, List<ScoredRecord> records);
}

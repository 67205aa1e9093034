package com.wellbeingplatform.common.store;

import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.Session;
import com.wellbeingplatform.common.model.SessionReport;

/**
 * Outbound persistence collaborator. Receives every periodic
 * {@link IntegratedAnalysis} tick and the final {@link SessionReport} as opaque records
 * keyed by session id, user id and timestamp.
 *
 * <p>Implementations MUST NOT block the processing paths for long; failures may be
 * thrown and are absorbed (logged) by the orchestrator.
 */
public interface AnalysisRecordStore {

    void storeTick(Session session, IntegratedAnalysis analysis);

    void storeReport(SessionReport report);
}

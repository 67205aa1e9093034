package com.wellbeingplatform.orchestrator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wellbeingplatform.common.exception.AnalysisException;
import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.Session;
import com.wellbeingplatform.common.model.SessionReport;
import com.wellbeingplatform.common.store.AnalysisRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default persistence collaborator: renders every tick and the session report as one
 * JSON line on the {@value #RECORD_LOGGER} logger. Route that logger to a file or a
 * shipper in the logging configuration.
 *
 * <pre>
 *   {"recordType":"tick","sessionId":"…","userId":"…","timestamp":"…","payload":{…}}
 * </pre>
 */
@Component
public class JsonAnalysisRecordStore implements AnalysisRecordStore {

    public static final String RECORD_LOGGER = "wellbeing.records";

    private static final Logger records = LoggerFactory.getLogger(RECORD_LOGGER);

    private final ObjectMapper objectMapper;

    public JsonAnalysisRecordStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void storeTick(Session session, IntegratedAnalysis analysis) {
        records.info(render("tick", session, analysis.timestamp(), analysis));
    }

    @Override
    public void storeReport(SessionReport report) {
        Session session = report.session();
        Instant at = session.endTime() != null ? session.endTime() : Instant.now();
        records.info(render("report", session, at, report));
    }

    String render(String recordType, Session session, Instant timestamp, Object payload) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("recordType", recordType);
        record.put("sessionId", session.id());
        record.put("userId", session.userId());
        record.put("timestamp", timestamp);
        record.put("payload", payload);
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new AnalysisException("Failed to serialise " + recordType + " record for session " + session.id(), e);
        }
    }
}

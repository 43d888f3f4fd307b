package tech.charforge.queue.embedded;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import tech.charforge.queue.QueueException;
import tech.charforge.queue.model.JobError;
import tech.charforge.queue.model.JobResult;

import java.util.Map;

/**
 * Jackson mapping for the JSON columns of the job table.
 */
final class JobJsonCodec {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    String writePayload(Map<String, Object> payload) {
        return write(payload);
    }

    Map<String, Object> readPayload(String json) {
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new QueueException("Corrupt job payload", e);
        }
    }

    String writeError(JobError error) {
        return error == null ? null : write(error);
    }

    JobError readError(String json) {
        return json == null ? null : read(json, JobError.class);
    }

    String writeResult(JobResult result) {
        return result == null ? null : write(result);
    }

    JobResult readResult(String json) {
        return json == null ? null : read(json, JobResult.class);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new QueueException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new QueueException("Corrupt " + type.getSimpleName() + " column", e);
        }
    }
}

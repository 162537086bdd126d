package io.jsoninject.core.engine;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import io.jsoninject.core.error.ContractViolationException;
import io.jsoninject.core.model.JsonPayload;
import io.jsoninject.core.model.SourceType;
import java.io.IOException;

/**
 * Checks that a payload is exactly one JSON document by streaming it through a Jackson parser.
 * No tree is built, so large payloads cost only a single pass.
 *
 * <p>Thread-safe: the shared {@link JsonFactory} is thread-safe.
 */
final class PayloadVerifier {

    private static final JsonFactory FACTORY = new JsonFactory();

    private PayloadVerifier() {}

    /**
     * @throws ContractViolationException if the payload is empty, malformed, or holds more than one
     *     root value
     */
    static void verify(JsonPayload payload, String injectionName, SourceType source) {
        try (JsonParser parser = FACTORY.createParser(payload.text())) {
            JsonToken first = parser.nextToken();
            if (first == null) {
                throw new ContractViolationException("Payload is empty", injectionName, source);
            }
            parser.skipChildren();
            if (parser.nextToken() != null) {
                throw new ContractViolationException(
                        "Payload holds more than one JSON value", injectionName, source);
            }
        } catch (JsonProcessingException e) {
            throw new ContractViolationException(
                    "Payload is not valid JSON: " + e.getOriginalMessage(), e, injectionName, source);
        } catch (IOException e) {
            throw new ContractViolationException("Payload could not be read: " + e.getMessage(), e, injectionName, source);
        }
    }
}

package com.rcmp.marketplace.infrastructure.payment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Subset of a Stripe event envelope. {@code data.object} varies by event type
 * and is kept as a tree.
 *
 * @author Marketplace Team
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StripeEvent {

    public static final String CHECKOUT_SESSION_COMPLETED = "checkout.session.completed";

    public String id;
    public String type;
    public Data data;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Data {
        public JsonNode object;
    }

    /**
     * Id of the object the event is about (the checkout session for completion events).
     *
     * @return Object id or null
     */
    public String objectId() {
        return text(object(), "id");
    }

    /**
     * Read one metadata entry of the event object.
     *
     * @param key Metadata key
     * @return Value, or null if absent
     */
    public String metadata(String key) {
        JsonNode obj = object();
        if (obj == null) {
            return null;
        }
        return text(obj.get("metadata"), key);
    }

    private JsonNode object() {
        return data == null ? null : data.object;
    }

    private static String text(JsonNode node, String field) {
        if (node == null || node.get(field) == null || node.get(field).isNull()) {
            return null;
        }
        return node.get(field).asText(null);
    }
}

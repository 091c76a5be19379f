package io.avalonrest.server.core.binding;

import io.avalonrest.json.spi.JsonNode;
import io.avalonrest.server.core.multipart.FormField;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Request body parsed once and shared by every parameter resolution of that request.
 */
public final class RequestSnapshot {
    private final byte[] rawBody;
    private final String contentType;
    private final boolean jsonRequest;
    private final JsonNode document; // null unless a non-empty JSON body was parsed
    private final Map<String, String> formFields; // null unless form data was decoded
    private final Map<String, FormField> multipartFields; // null unless multipart was decoded
    private String bodyText;

    RequestSnapshot(byte[] rawBody, String contentType, boolean jsonRequest, JsonNode document,
                    Map<String, String> formFields, Map<String, FormField> multipartFields) {
        this.rawBody = rawBody == null ? new byte[0] : rawBody;
        this.contentType = contentType;
        this.jsonRequest = jsonRequest;
        this.document = document;
        this.formFields = formFields;
        this.multipartFields = multipartFields;
    }

    public byte[] rawBody() {
        return rawBody;
    }

    /**
     * The body decoded as UTF-8.
     */
    public String bodyText() {
        if (bodyText == null) {
            bodyText = new String(rawBody, StandardCharsets.UTF_8);
        }
        return bodyText;
    }

    public String contentType() {
        return contentType;
    }

    /**
     * True when the content type is JSON or the handler declares a body parameter.
     */
    public boolean isJsonRequest() {
        return jsonRequest;
    }

    public JsonNode document() {
        return document;
    }

    public Map<String, String> formFields() {
        return formFields;
    }

    public Map<String, FormField> multipartFields() {
        return multipartFields;
    }

    public boolean hasFormData() {
        return formFields != null || multipartFields != null;
    }
}

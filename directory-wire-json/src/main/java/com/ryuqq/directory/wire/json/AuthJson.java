package com.ryuqq.directory.wire.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.directory.core.auth.AuthAllowed;
import com.ryuqq.directory.core.auth.AuthCredential;
import com.ryuqq.directory.core.auth.AuthRequest;
import com.ryuqq.directory.core.auth.AuthResponse;
import com.ryuqq.directory.core.auth.AuthState;
import com.ryuqq.directory.core.auth.AuthStep;
import com.ryuqq.directory.core.auth.SessionId;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of the authentication exchange.
 *
 * <pre>
 * AuthRequest   {"step":{"Init":["alice",null]}}
 *               {"step":{"Creds":["Anonymous",{"Password":"..."}]},"sessionid":"..."}
 * AuthResponse  {"sessionid":"...","state":{"Continue":["Anonymous"]}}
 *               {"sessionid":"...","state":{"Denied":"authentication denied"}}
 *               {"sessionid":"...","state":{"Success":{...token...}}}
 * </pre>
 *
 * <p>The session id rides in the request body only when the transport does not carry it.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
final class AuthJson {

    static final String INIT = "Init";
    static final String CREDS = "Creds";
    static final String ANONYMOUS = "Anonymous";
    static final String PASSWORD = "Password";
    static final String SUCCESS = "Success";
    static final String DENIED = "Denied";
    static final String CONTINUE = "Continue";
    static final String STEP = "step";
    static final String STATE = "state";
    static final String SESSION_ID = "sessionid";

    private AuthJson() {
        throw new UnsupportedOperationException("Utility class");
    }

    // ============================================================
    // AuthAllowed / AuthCredential
    // ============================================================

    static AuthAllowed readAllowed(JsonNode node, DeserializationContext ctxt) throws IOException {
        String name = TaggedJson.readText(node, ctxt, AuthAllowed.class, "mechanism");
        return TaggedJson.construct(ctxt, AuthAllowed.class, () -> AuthAllowed.fromWireName(name));
    }

    static void writeCredential(AuthCredential credential, JsonGenerator gen) throws IOException {
        if (credential instanceof AuthCredential.Password password) {
            TaggedJson.writeNewtype(gen, PASSWORD, password.secret());
        } else {
            TaggedJson.writeUnit(gen, ANONYMOUS);
        }
    }

    static AuthCredential readCredential(JsonNode node, DeserializationContext ctxt) throws IOException {
        TaggedJson.Tagged tagged = TaggedJson.readTagged(node, ctxt, AuthCredential.class);
        if (ANONYMOUS.equals(tagged.tag())) {
            return tagged.isUnit() ? AuthCredential.anonymous() : TaggedJson.unexpectedUnit(ctxt, AuthCredential.class, tagged);
        }
        if (PASSWORD.equals(tagged.tag())) {
            if (tagged.isUnit()) {
                return TaggedJson.unexpectedUnit(ctxt, AuthCredential.class, tagged);
            }
            String secret = TaggedJson.readText(tagged.payload(), ctxt, AuthCredential.class, "password");
            return TaggedJson.construct(ctxt, AuthCredential.class, () -> AuthCredential.password(secret));
        }
        return TaggedJson.unknownTag(ctxt, AuthCredential.class, tagged.tag());
    }

    // ============================================================
    // AuthStep
    // ============================================================

    static void writeStep(AuthStep step, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        if (step instanceof AuthStep.Init init) {
            gen.writeFieldName(INIT);
            gen.writeStartArray();
            gen.writeString(init.name());
            if (init.applicationId() == null) {
                gen.writeNull();
            } else {
                gen.writeString(init.applicationId());
            }
            gen.writeEndArray();
        } else {
            gen.writeFieldName(CREDS);
            gen.writeStartArray();
            for (AuthCredential credential : ((AuthStep.Creds) step).credentials()) {
                writeCredential(credential, gen);
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();
    }

    static AuthStep readStep(JsonNode node, DeserializationContext ctxt) throws IOException {
        TaggedJson.Tagged tagged = TaggedJson.readTagged(node, ctxt, AuthStep.class);
        if (tagged.isUnit()) {
            return INIT.equals(tagged.tag()) || CREDS.equals(tagged.tag())
                ? TaggedJson.unexpectedUnit(ctxt, AuthStep.class, tagged)
                : TaggedJson.unknownTag(ctxt, AuthStep.class, tagged.tag());
        }
        if (INIT.equals(tagged.tag())) {
            List<JsonNode> pair = TaggedJson.readTuple(tagged.payload(), 2, ctxt, AuthStep.class, INIT);
            String name = TaggedJson.readText(pair.get(0), ctxt, AuthStep.class, "Init name");
            String applicationId = TaggedJson.readOptionalText(pair.get(1), ctxt, AuthStep.class, "Init application id");
            return TaggedJson.construct(ctxt, AuthStep.class, () -> new AuthStep.Init(name, applicationId));
        }
        if (CREDS.equals(tagged.tag())) {
            List<AuthCredential> credentials = new ArrayList<>();
            for (JsonNode item : TaggedJson.readArray(tagged.payload(), ctxt, AuthStep.class, CREDS)) {
                credentials.add(readCredential(item, ctxt));
            }
            return new AuthStep.Creds(credentials);
        }
        return TaggedJson.unknownTag(ctxt, AuthStep.class, tagged.tag());
    }

    // ============================================================
    // AuthState
    // ============================================================

    static void writeState(AuthState state, JsonGenerator gen) throws IOException {
        if (state instanceof AuthState.Success success) {
            gen.writeStartObject();
            gen.writeFieldName(SUCCESS);
            IdentityJson.writeToken(success.token(), gen);
            gen.writeEndObject();
        } else if (state instanceof AuthState.Denied denied) {
            TaggedJson.writeNewtype(gen, DENIED, denied.reason());
        } else {
            gen.writeStartObject();
            gen.writeFieldName(CONTINUE);
            gen.writeStartArray();
            for (AuthAllowed allowed : ((AuthState.Continue) state).allowed()) {
                gen.writeString(allowed.wireName());
            }
            gen.writeEndArray();
            gen.writeEndObject();
        }
    }

    static AuthState readState(JsonNode node, DeserializationContext ctxt) throws IOException {
        TaggedJson.Tagged tagged = TaggedJson.readTagged(node, ctxt, AuthState.class);
        if (tagged.isUnit()) {
            return TaggedJson.unexpectedUnit(ctxt, AuthState.class, tagged);
        }
        switch (tagged.tag()) {
            case SUCCESS -> {
                return new AuthState.Success(IdentityJson.readToken(tagged.payload(), ctxt));
            }
            case DENIED -> {
                String reason = TaggedJson.readText(tagged.payload(), ctxt, AuthState.class, "Denied reason");
                return TaggedJson.construct(ctxt, AuthState.class, () -> new AuthState.Denied(reason));
            }
            case CONTINUE -> {
                List<AuthAllowed> allowed = new ArrayList<>();
                for (JsonNode item : TaggedJson.readArray(tagged.payload(), ctxt, AuthState.class, CONTINUE)) {
                    allowed.add(readAllowed(item, ctxt));
                }
                return TaggedJson.construct(ctxt, AuthState.class, () -> new AuthState.Continue(allowed));
            }
            default -> {
                return TaggedJson.unknownTag(ctxt, AuthState.class, tagged.tag());
            }
        }
    }

    // ============================================================
    // SessionId / AuthRequest / AuthResponse
    // ============================================================

    static SessionId readSessionId(JsonNode node, DeserializationContext ctxt) throws IOException {
        String value = TaggedJson.readText(node, ctxt, SessionId.class, SESSION_ID);
        return TaggedJson.construct(ctxt, SessionId.class, () -> SessionId.parse(value));
    }

    static void writeRequest(AuthRequest request, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeFieldName(STEP);
        writeStep(request.step(), gen);
        if (request.sessionId() != null) {
            gen.writeStringField(SESSION_ID, request.sessionId().toString());
        }
        gen.writeEndObject();
    }

    static AuthRequest readRequest(JsonNode node, DeserializationContext ctxt) throws IOException {
        AuthStep step = readStep(TaggedJson.requireField(node, STEP, ctxt, AuthRequest.class), ctxt);
        JsonNode sessionNode = node.get(SESSION_ID);
        SessionId sessionId = sessionNode == null || sessionNode.isNull() ? null : readSessionId(sessionNode, ctxt);
        return new AuthRequest(sessionId, step);
    }

    static void writeResponse(AuthResponse response, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField(SESSION_ID, response.sessionId().toString());
        gen.writeFieldName(STATE);
        writeState(response.state(), gen);
        gen.writeEndObject();
    }

    static AuthResponse readResponse(JsonNode node, DeserializationContext ctxt) throws IOException {
        SessionId sessionId = readSessionId(TaggedJson.requireField(node, SESSION_ID, ctxt, AuthResponse.class), ctxt);
        AuthState state = readState(TaggedJson.requireField(node, STATE, ctxt, AuthResponse.class), ctxt);
        return new AuthResponse(sessionId, state);
    }
}

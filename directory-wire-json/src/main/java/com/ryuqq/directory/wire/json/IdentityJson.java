package com.ryuqq.directory.wire.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.directory.core.identity.Application;
import com.ryuqq.directory.core.identity.Claim;
import com.ryuqq.directory.core.identity.Group;
import com.ryuqq.directory.core.identity.UserAuthToken;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of {@link UserAuthToken}.
 *
 * <pre>
 * {"name":"alice","displayname":"Alice","uuid":"...",
 *  "application":null,"groups":[{"name":"admins","uuid":"..."}],"claims":[]}
 * </pre>
 *
 * @author Directory Team
 * @since 1.0.0
 */
final class IdentityJson {

    private IdentityJson() {
        throw new UnsupportedOperationException("Utility class");
    }

    static void writeToken(UserAuthToken token, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", token.name());
        gen.writeStringField("displayname", token.displayName());
        gen.writeStringField("uuid", token.uuid());
        gen.writeFieldName("application");
        if (token.application() == null) {
            gen.writeNull();
        } else {
            writeNamed(gen, token.application().name(), token.application().uuid());
        }
        gen.writeFieldName("groups");
        gen.writeStartArray();
        for (Group group : token.groups()) {
            writeNamed(gen, group.name(), group.uuid());
        }
        gen.writeEndArray();
        gen.writeFieldName("claims");
        gen.writeStartArray();
        for (Claim claim : token.claims()) {
            writeNamed(gen, claim.name(), claim.uuid());
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    static UserAuthToken readToken(JsonNode node, DeserializationContext ctxt) throws IOException {
        Class<?> type = UserAuthToken.class;
        String name = TaggedJson.readText(TaggedJson.requireField(node, "name", ctxt, type), ctxt, type, "name");
        String displayName = TaggedJson.readText(TaggedJson.requireField(node, "displayname", ctxt, type), ctxt, type, "displayname");
        String uuid = TaggedJson.readText(TaggedJson.requireField(node, "uuid", ctxt, type), ctxt, type, "uuid");

        JsonNode applicationNode = node.get("application");
        Application application = null;
        if (applicationNode != null && !applicationNode.isNull()) {
            String appName = readName(applicationNode, ctxt);
            String appUuid = readUuid(applicationNode, ctxt);
            application = TaggedJson.construct(ctxt, type, () -> new Application(appName, appUuid));
        }

        List<Group> groups = new ArrayList<>();
        for (JsonNode item : TaggedJson.readArray(TaggedJson.requireField(node, "groups", ctxt, type), ctxt, type, "groups")) {
            String groupName = readName(item, ctxt);
            String groupUuid = readUuid(item, ctxt);
            groups.add(TaggedJson.construct(ctxt, type, () -> new Group(groupName, groupUuid)));
        }

        List<Claim> claims = new ArrayList<>();
        for (JsonNode item : TaggedJson.readArray(TaggedJson.requireField(node, "claims", ctxt, type), ctxt, type, "claims")) {
            String claimName = readName(item, ctxt);
            String claimUuid = readUuid(item, ctxt);
            claims.add(TaggedJson.construct(ctxt, type, () -> new Claim(claimName, claimUuid)));
        }

        Application resolved = application;
        return TaggedJson.construct(ctxt, type,
            () -> new UserAuthToken(name, displayName, uuid, resolved, groups, claims));
    }

    private static void writeNamed(JsonGenerator gen, String name, String uuid) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", name);
        gen.writeStringField("uuid", uuid);
        gen.writeEndObject();
    }

    private static String readName(JsonNode node, DeserializationContext ctxt) throws IOException {
        return TaggedJson.readText(TaggedJson.requireField(node, "name", ctxt, UserAuthToken.class), ctxt, UserAuthToken.class, "name");
    }

    private static String readUuid(JsonNode node, DeserializationContext ctxt) throws IOException {
        return TaggedJson.readText(TaggedJson.requireField(node, "uuid", ctxt, UserAuthToken.class), ctxt, UserAuthToken.class, "uuid");
    }
}

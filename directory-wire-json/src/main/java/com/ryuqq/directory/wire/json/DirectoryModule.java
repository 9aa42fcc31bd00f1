package com.ryuqq.directory.wire.json;

import com.fasterxml.jackson.databind.module.SimpleModule;
import com.ryuqq.directory.core.auth.AuthAllowed;
import com.ryuqq.directory.core.auth.AuthCredential;
import com.ryuqq.directory.core.auth.AuthRequest;
import com.ryuqq.directory.core.auth.AuthResponse;
import com.ryuqq.directory.core.auth.AuthState;
import com.ryuqq.directory.core.auth.AuthStep;
import com.ryuqq.directory.core.auth.SessionId;
import com.ryuqq.directory.core.contract.CreateRequest;
import com.ryuqq.directory.core.contract.DeleteRequest;
import com.ryuqq.directory.core.contract.ModifyRequest;
import com.ryuqq.directory.core.contract.OperationResponse;
import com.ryuqq.directory.core.contract.ReviveRecycledRequest;
import com.ryuqq.directory.core.contract.SearchRecycledRequest;
import com.ryuqq.directory.core.contract.SearchRequest;
import com.ryuqq.directory.core.contract.SearchResponse;
import com.ryuqq.directory.core.contract.WhoamiRequest;
import com.ryuqq.directory.core.contract.WhoamiResponse;
import com.ryuqq.directory.core.entry.Entry;
import com.ryuqq.directory.core.error.ConsistencyError;
import com.ryuqq.directory.core.error.OperationError;
import com.ryuqq.directory.core.error.SchemaError;
import com.ryuqq.directory.core.filter.Filter;
import com.ryuqq.directory.core.identity.UserAuthToken;
import com.ryuqq.directory.core.modify.Modify;
import com.ryuqq.directory.core.modify.ModifyList;

/**
 * Jackson module registering the wire form of every protocol type.
 *
 * <p>Serializers are looked up by declared interface, so the sealed variants
 * ({@code Filter.Eq}, {@code AuthState.Success}, ...) all resolve to their parent's form.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public class DirectoryModule extends SimpleModule {

    private static final long serialVersionUID = 1L;

    /**
     * @param maxFilterDepth deepest filter accepted or produced
     */
    public DirectoryModule(int maxFilterDepth) {
        super("DirectoryModule");
        if (maxFilterDepth < 1) {
            throw new IllegalArgumentException("maxFilterDepth must be at least 1 (current: " + maxFilterDepth + ")");
        }

        addSerializer(Filter.class, new FilterJson.Serializer(maxFilterDepth));
        addDeserializer(Filter.class, new FilterJson.Deserializer(maxFilterDepth));

        addSerializer(Entry.class, JsonAdapters.serializer(Entry.class, EntryJson::writeEntry));
        addDeserializer(Entry.class, JsonAdapters.deserializer(Entry.class, EntryJson::readEntry));
        addSerializer(Modify.class, JsonAdapters.serializer(Modify.class, EntryJson::writeModify));
        addDeserializer(Modify.class, JsonAdapters.deserializer(Modify.class, EntryJson::readModify));
        addSerializer(ModifyList.class, JsonAdapters.serializer(ModifyList.class, EntryJson::writeModifyList));
        addDeserializer(ModifyList.class, JsonAdapters.deserializer(ModifyList.class, EntryJson::readModifyList));

        addSerializer(UserAuthToken.class, JsonAdapters.serializer(UserAuthToken.class, IdentityJson::writeToken));
        addDeserializer(UserAuthToken.class, JsonAdapters.deserializer(UserAuthToken.class, IdentityJson::readToken));

        registerAuth();
        registerErrors();
        registerEnvelope(maxFilterDepth);
    }

    private void registerAuth() {
        addSerializer(AuthAllowed.class, JsonAdapters.serializer(AuthAllowed.class,
            (allowed, gen) -> gen.writeString(allowed.wireName())));
        addDeserializer(AuthAllowed.class, JsonAdapters.deserializer(AuthAllowed.class, AuthJson::readAllowed));
        addSerializer(AuthCredential.class, JsonAdapters.serializer(AuthCredential.class, AuthJson::writeCredential));
        addDeserializer(AuthCredential.class, JsonAdapters.deserializer(AuthCredential.class, AuthJson::readCredential));
        addSerializer(AuthStep.class, JsonAdapters.serializer(AuthStep.class, AuthJson::writeStep));
        addDeserializer(AuthStep.class, JsonAdapters.deserializer(AuthStep.class, AuthJson::readStep));
        addSerializer(AuthState.class, JsonAdapters.serializer(AuthState.class, AuthJson::writeState));
        addDeserializer(AuthState.class, JsonAdapters.deserializer(AuthState.class, AuthJson::readState));
        addSerializer(SessionId.class, JsonAdapters.serializer(SessionId.class,
            (sessionId, gen) -> gen.writeString(sessionId.toString())));
        addDeserializer(SessionId.class, JsonAdapters.deserializer(SessionId.class, AuthJson::readSessionId));
        addSerializer(AuthRequest.class, JsonAdapters.serializer(AuthRequest.class, AuthJson::writeRequest));
        addDeserializer(AuthRequest.class, JsonAdapters.deserializer(AuthRequest.class, AuthJson::readRequest));
        addSerializer(AuthResponse.class, JsonAdapters.serializer(AuthResponse.class, AuthJson::writeResponse));
        addDeserializer(AuthResponse.class, JsonAdapters.deserializer(AuthResponse.class, AuthJson::readResponse));
    }

    private void registerErrors() {
        addSerializer(SchemaError.class, JsonAdapters.serializer(SchemaError.class, ErrorJson::writeSchemaError));
        addDeserializer(SchemaError.class, JsonAdapters.deserializer(SchemaError.class, ErrorJson::readSchemaError));
        addSerializer(ConsistencyError.class, JsonAdapters.serializer(ConsistencyError.class, ErrorJson::writeConsistencyError));
        addDeserializer(ConsistencyError.class, JsonAdapters.deserializer(ConsistencyError.class, ErrorJson::readConsistencyError));
        addSerializer(OperationError.class, JsonAdapters.serializer(OperationError.class, ErrorJson::writeOperationError));
        addDeserializer(OperationError.class, JsonAdapters.deserializer(OperationError.class, ErrorJson::readOperationError));
    }

    private void registerEnvelope(int maxFilterDepth) {
        EnvelopeJson.Handlers handlers = new EnvelopeJson.Handlers(maxFilterDepth);

        addSerializer(SearchRequest.class, JsonAdapters.serializer(SearchRequest.class,
            (request, gen) -> handlers.writeFilterRequest(request.filter(), gen)));
        addDeserializer(SearchRequest.class, JsonAdapters.deserializer(SearchRequest.class,
            (node, ctxt) -> new SearchRequest(handlers.readFilterField(node, ctxt, SearchRequest.class))));

        addSerializer(DeleteRequest.class, JsonAdapters.serializer(DeleteRequest.class,
            (request, gen) -> handlers.writeFilterRequest(request.filter(), gen)));
        addDeserializer(DeleteRequest.class, JsonAdapters.deserializer(DeleteRequest.class,
            (node, ctxt) -> new DeleteRequest(handlers.readFilterField(node, ctxt, DeleteRequest.class))));

        addSerializer(SearchRecycledRequest.class, JsonAdapters.serializer(SearchRecycledRequest.class,
            (request, gen) -> handlers.writeFilterRequest(request.filter(), gen)));
        addDeserializer(SearchRecycledRequest.class, JsonAdapters.deserializer(SearchRecycledRequest.class,
            (node, ctxt) -> new SearchRecycledRequest(handlers.readFilterField(node, ctxt, SearchRecycledRequest.class))));

        addSerializer(ReviveRecycledRequest.class, JsonAdapters.serializer(ReviveRecycledRequest.class,
            (request, gen) -> handlers.writeFilterRequest(request.filter(), gen)));
        addDeserializer(ReviveRecycledRequest.class, JsonAdapters.deserializer(ReviveRecycledRequest.class,
            (node, ctxt) -> new ReviveRecycledRequest(handlers.readFilterField(node, ctxt, ReviveRecycledRequest.class))));

        addSerializer(ModifyRequest.class, JsonAdapters.serializer(ModifyRequest.class, handlers::writeModifyRequest));
        addDeserializer(ModifyRequest.class, JsonAdapters.deserializer(ModifyRequest.class, handlers::readModifyRequest));

        addSerializer(SearchResponse.class, JsonAdapters.serializer(SearchResponse.class,
            (response, gen) -> EnvelopeJson.writeEntries(response.entries(), gen)));
        addDeserializer(SearchResponse.class, JsonAdapters.deserializer(SearchResponse.class, EnvelopeJson::readSearchResponse));

        addSerializer(CreateRequest.class, JsonAdapters.serializer(CreateRequest.class,
            (request, gen) -> EnvelopeJson.writeEntries(request.entries(), gen)));
        addDeserializer(CreateRequest.class, JsonAdapters.deserializer(CreateRequest.class, EnvelopeJson::readCreateRequest));

        addSerializer(OperationResponse.class, JsonAdapters.serializer(OperationResponse.class, EnvelopeJson::writeEmpty));
        addDeserializer(OperationResponse.class, JsonAdapters.deserializer(OperationResponse.class, EnvelopeJson::readOperationResponse));

        addSerializer(WhoamiRequest.class, JsonAdapters.serializer(WhoamiRequest.class, EnvelopeJson::writeEmpty));
        addDeserializer(WhoamiRequest.class, JsonAdapters.deserializer(WhoamiRequest.class, EnvelopeJson::readWhoamiRequest));

        addSerializer(WhoamiResponse.class, JsonAdapters.serializer(WhoamiResponse.class, EnvelopeJson::writeWhoami));
        addDeserializer(WhoamiResponse.class, JsonAdapters.deserializer(WhoamiResponse.class, EnvelopeJson::readWhoami));
    }
}

/**
 * Request/response envelope.
 *
 * <p>Each operation is a request/response pair carrying its payload and nothing else:</p>
 * <ul>
 *   <li>Search: {@link com.ryuqq.directory.core.contract.SearchRequest} → {@link com.ryuqq.directory.core.contract.SearchResponse}</li>
 *   <li>Create: {@link com.ryuqq.directory.core.contract.CreateRequest} → {@link com.ryuqq.directory.core.contract.OperationResponse}</li>
 *   <li>Delete: {@link com.ryuqq.directory.core.contract.DeleteRequest} → {@link com.ryuqq.directory.core.contract.OperationResponse}</li>
 *   <li>Modify: {@link com.ryuqq.directory.core.contract.ModifyRequest} → {@link com.ryuqq.directory.core.contract.OperationResponse}</li>
 *   <li>Whoami: {@link com.ryuqq.directory.core.contract.WhoamiRequest} → {@link com.ryuqq.directory.core.contract.WhoamiResponse}</li>
 *   <li>SearchRecycled / ReviveRecycled: recycle bin operations</li>
 * </ul>
 *
 * <p>Authentication request/response types live in {@code com.ryuqq.directory.core.auth}.</p>
 *
 * @since 1.0.0
 * @author Directory Team
 */
package com.ryuqq.directory.core.contract;

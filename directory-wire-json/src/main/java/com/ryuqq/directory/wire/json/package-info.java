/**
 * JSON wire form of the directory protocol.
 *
 * <p>Enums are encoded as externally tagged values: unit variants as a bare string
 * ({@code "Self"}), newtype variants as a single-key object ({@code {"Pres":"mail"}}) and
 * tuple variants as a single-key object holding an array ({@code {"Eq":["name","alice"]}}).
 * {@link com.ryuqq.directory.wire.json.WireCodec} is the only public entry point.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
package com.ryuqq.directory.wire.json;

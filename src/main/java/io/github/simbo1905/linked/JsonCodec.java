// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.linked;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.linked.Container.LOGGER;

/// Encodes and decodes a JSON array of elements of one type using Jackson. The element encoding is whatever the
/// mapper does for the element type so the array form is lossless whenever that is.
public final class JsonCodec<T> {

  /// Shared mapper used unless a caller supplies their own. Knows how to write and read the linked containers so
  /// that elements may themselves be queues or stacks.
  static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper().registerModule(new LinkedContainersModule());

  private static final JsonCodec<Object> ANY = forJavaType(DEFAULT_MAPPER, DEFAULT_MAPPER.constructType(Object.class));

  final ObjectMapper mapper;
  final JavaType elementType;
  private final ObjectWriter writer;
  private final ObjectReader reader;

  private JsonCodec(ObjectMapper mapper, JavaType elementType) {
    this.mapper = mapper;
    this.elementType = elementType;
    final JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, elementType);
    this.writer = mapper.writerFor(listType);
    this.reader = mapper.readerFor(listType).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  /// Codec for a plain element class using the default mapper.
  public static <T> JsonCodec<T> forClass(Class<T> elementClass) {
    Objects.requireNonNull(elementClass, "elementClass must not be null");
    return forJavaType(DEFAULT_MAPPER, DEFAULT_MAPPER.constructType(elementClass));
  }

  /// Codec for a generic element type such as `List<String>` using the default mapper.
  public static <T> JsonCodec<T> forType(TypeReference<T> elementType) {
    Objects.requireNonNull(elementType, "elementType must not be null");
    return forJavaType(DEFAULT_MAPPER, DEFAULT_MAPPER.constructType(elementType));
  }

  /// Codec with a caller supplied mapper. The caller is trusted that `elementType` describes `T`.
  public static <T> JsonCodec<T> forJavaType(ObjectMapper mapper, JavaType elementType) {
    Objects.requireNonNull(mapper, "mapper must not be null");
    Objects.requireNonNull(elementType, "elementType must not be null");
    LOGGER.fine(() -> "Creating JSON codec for element type " + elementType);
    return new JsonCodec<>(mapper, elementType);
  }

  /// Codec for untyped elements. Decoding yields the plain Jackson types: `Integer`, `Long`, `Double`, `String`,
  /// `Boolean`, `List` and `Map`.
  public static JsonCodec<Object> forAny() {
    return ANY;
  }

  public JavaType elementType() {
    return elementType;
  }

  public byte[] encode(List<T> values) throws JsonProcessingException {
    return writer.writeValueAsBytes(values);
  }

  public String encodeToString(List<T> values) throws JsonProcessingException {
    return writer.writeValueAsString(values);
  }

  /// Decode a JSON array of elements.
  /// @throws IOException Jackson's own exception when the bytes are not a JSON array of the element type, or a
  /// {@link JsonMappingException} when the array is `null` or holds a `null` element
  public List<T> decode(byte[] json) throws IOException {
    Objects.requireNonNull(json, "json must not be null");
    final List<T> decoded = reader.readValue(json);
    return checked(decoded);
  }

  public List<T> decode(String json) throws IOException {
    Objects.requireNonNull(json, "json must not be null");
    final List<T> decoded = reader.readValue(json);
    return checked(decoded);
  }

  private List<T> checked(List<T> decoded) throws JsonMappingException {
    if (decoded == null) {
      throw JsonMappingException.from((JsonParser) null, "Expected a JSON array of " + elementType + " but found null");
    }
    for (int i = 0; i < decoded.size(); i++) {
      if (decoded.get(i) == null) {
        throw JsonMappingException.from((JsonParser) null, "Element " + i + " is null; containers do not hold nulls");
      }
    }
    return decoded;
  }

  @Override
  public String toString() {
    return "JsonCodec[" + elementType + "]";
  }
}

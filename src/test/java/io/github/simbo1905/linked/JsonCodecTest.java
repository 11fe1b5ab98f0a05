// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package io.github.simbo1905.linked;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class JsonCodecTest {

  record Order(String clientId, long quantity) {}

  enum Side {BUY, SELL}

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @Test
  void encodesRecordsAsObjects() throws IOException {
    final var codec = JsonCodec.forClass(Order.class);
    final var orders = List.of(new Order("c1", 10), new Order("c2", 20));
    final String json = codec.encodeToString(orders);
    assertEquals("[{\"clientId\":\"c1\",\"quantity\":10},{\"clientId\":\"c2\",\"quantity\":20}]", json);
    assertEquals(orders, codec.decode(json.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void customMapperIsUsed() throws IOException {
    final var mapper = new ObjectMapper()
        .enable(SerializationFeature.WRITE_ENUMS_USING_INDEX)
        .registerModule(new LinkedContainersModule());
    final JsonCodec<Side> codec = JsonCodec.forJavaType(mapper, mapper.constructType(Side.class));
    final var queue = LinkedListQueue.forCodec(codec);
    queue.enqueue(Side.BUY);
    queue.enqueue(Side.SELL);
    assertEquals("[0,1]", queue.toJsonString());

    queue.fromJson("[\"SELL\",0]");
    assertEquals(List.of(Side.SELL, Side.BUY), queue.values());
  }

  @Test
  void rejectsNonArrays() {
    final var codec = JsonCodec.forClass(Integer.class);
    assertThrows(MismatchedInputException.class, () -> codec.decode("{}"));
    assertThrows(MismatchedInputException.class, () -> codec.decode(""));
    assertThrows(JsonMappingException.class, () -> codec.decode("null"));
  }

  @Test
  void rejectsNullElements() {
    final var codec = JsonCodec.forClass(String.class);
    final var e = assertThrows(JsonMappingException.class, () -> codec.decode("[\"a\",\"b\",null]"));
    assertThat(e.getOriginalMessage()).isEqualTo("Element 2 is null; containers do not hold nulls");
  }

  @Test
  void anyCodecIsShared() {
    assertSame(JsonCodec.forAny(), JsonCodec.forAny());
    assertEquals(Object.class, JsonCodec.forAny().elementType().getRawClass());
    assertThat(JsonCodec.forClass(Long.class).toString()).contains("java.lang.Long");
  }

  @Test
  void factoriesRejectNulls() {
    assertThrows(NullPointerException.class, () -> JsonCodec.forClass(null));
    assertThrows(NullPointerException.class, () -> JsonCodec.forType(null));
    assertThrows(NullPointerException.class, () -> LinkedListQueue.forCodec(null));
    assertThrows(NullPointerException.class, () -> LinkedListStack.forCodec(null));
  }

  @Test
  void unserializableElementSurfacesOnToJsonButNotToString() {
    final var queue = LinkedListQueue.forAny();
    queue.enqueue(new Object());
    assertThrows(JsonProcessingException.class, queue::toJson);
    assertThat(queue.toString()).startsWith("LinkedListQueue: <");
  }
}

// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.linked;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.List;

/// Jackson module that writes and reads the linked containers as plain JSON arrays wherever they appear inside a
/// larger document, for example as a record component or as an element of another container.
///
/// A queue is written in dequeue order and a stack in push order, the same bodies as their `toJson()`. On the read
/// side the element type comes from the declared generic type, `LinkedListQueue<Integer>` reads integers, and a raw
/// declaration reads plain Jackson types.
public final class LinkedContainersModule extends SimpleModule {

  public LinkedContainersModule() {
    super(LinkedContainersModule.class.getSimpleName());
    addSerializer(new QueueSerializer());
    addSerializer(new StackSerializer());
  }

  @Override
  public void setupModule(SetupContext context) {
    super.setupModule(context);
    context.addDeserializers(new ContainerDeserializers());
  }

  static final class QueueSerializer extends StdSerializer<Queue<?>> {
    QueueSerializer() {
      super(Queue.class, false);
    }

    @Override
    public void serialize(Queue<?> queue, JsonGenerator gen, SerializerProvider provider) throws IOException {
      provider.defaultSerializeValue(queue.values(), gen);
    }
  }

  static final class StackSerializer extends StdSerializer<Stack<?>> {
    StackSerializer() {
      super(Stack.class, false);
    }

    @Override
    public void serialize(Stack<?> stack, JsonGenerator gen, SerializerProvider provider) throws IOException {
      provider.defaultSerializeValue(stack.listValues(), gen);
    }
  }

  static final class ContainerDeserializers extends Deserializers.Base {
    @Override
    public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
      final Class<?> raw = type.getRawClass();
      if (raw == LinkedListQueue.class || raw == Queue.class) {
        return new QueueDeserializer(type, type.containedTypeOrUnknown(0));
      }
      if (raw == LinkedListStack.class || raw == Stack.class) {
        return new StackDeserializer(type, type.containedTypeOrUnknown(0));
      }
      return null;
    }
  }

  /// Reads the array into a list first so that a failure never produces a half filled container.
  abstract static class ContainerDeserializer<C extends Container<Object>> extends StdDeserializer<C> {
    final JavaType elementType;

    ContainerDeserializer(JavaType containerType, JavaType elementType) {
      super(containerType);
      this.elementType = elementType;
    }

    abstract C create(JsonCodec<Object> codec);

    abstract void add(C container, Object value);

    @Override
    public C deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      final JavaType listType = ctxt.getTypeFactory().constructCollectionType(List.class, elementType);
      final List<Object> values = ctxt.readValue(p, listType);
      for (int i = 0; i < values.size(); i++) {
        if (values.get(i) == null) {
          return ctxt.reportInputMismatch(this, "Element %d of %s is null; containers do not hold nulls",
              i, handledType().getSimpleName());
        }
      }
      final ObjectMapper mapper = p.getCodec() instanceof ObjectMapper om ? om : JsonCodec.DEFAULT_MAPPER;
      final C container = create(JsonCodec.forJavaType(mapper, elementType));
      values.forEach(v -> add(container, v));
      return container;
    }
  }

  static final class QueueDeserializer extends ContainerDeserializer<LinkedListQueue<Object>> {
    QueueDeserializer(JavaType containerType, JavaType elementType) {
      super(containerType, elementType);
    }

    @Override
    LinkedListQueue<Object> create(JsonCodec<Object> codec) {
      return new LinkedListQueue<>(codec);
    }

    @Override
    void add(LinkedListQueue<Object> queue, Object value) {
      queue.enqueue(value);
    }
  }

  static final class StackDeserializer extends ContainerDeserializer<LinkedListStack<Object>> {
    StackDeserializer(JavaType containerType, JavaType elementType) {
      super(containerType, elementType);
    }

    @Override
    LinkedListStack<Object> create(JsonCodec<Object> codec) {
      return new LinkedListStack<>(codec);
    }

    @Override
    void add(LinkedListStack<Object> stack, Object value) {
      stack.push(value);
    }
  }
}

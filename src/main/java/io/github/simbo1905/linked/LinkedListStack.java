// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.linked;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.TestOnly;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;

/// A stack held as a singly linked chain behind a sentinel head node. The top of the stack is `head.next` and
/// only head insertion is used, so no tail is kept.
public final class LinkedListStack<T> implements Stack<T> {

  static final String NAME = "LinkedListStack";

  private final Node<T> head = new Node<>(null, null); // sentinel, only head.next is used
  private int size;

  final JsonCodec<T> codec;

  LinkedListStack(JsonCodec<T> codec) {
    this.codec = codec;
  }

  public static <T> LinkedListStack<T> forClass(Class<T> elementClass) {
    return new LinkedListStack<>(JsonCodec.forClass(elementClass));
  }

  public static <T> LinkedListStack<T> forCodec(JsonCodec<T> codec) {
    Objects.requireNonNull(codec, "codec must not be null");
    return new LinkedListStack<>(codec);
  }

  public static LinkedListStack<Object> forAny() {
    return new LinkedListStack<>(JsonCodec.forAny());
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public void push(@NotNull T value) {
    Objects.requireNonNull(value, "stack elements must not be null");
    head.next = new Node<>(value, head.next);
    size++;
  }

  @Override
  public Optional<T> pop() {
    if (size == 0) {
      return Optional.empty();
    }
    final Node<T> x = head.next;
    head.next = x.next;
    x.next = null;
    size--;
    return Optional.of(x.value);
  }

  @Override
  public Optional<T> peek() {
    if (size == 0) {
      return Optional.empty();
    }
    return Optional.of(head.next.value);
  }

  /// @return the elements top first
  @Override
  public List<T> values() {
    final List<T> values = new ArrayList<>(size);
    Node<T> x = head.next;
    for (int i = 0; i < size; i++, x = x.next) {
      values.add(x.value);
    }
    return values;
  }

  @Override
  public List<T> listValues() {
    final List<T> values = new ArrayList<>(Collections.nCopies(size, null));
    Node<T> x = head.next;
    for (int i = size - 1; i >= 0; i--, x = x.next) {
      values.set(i, x.value);
    }
    return values;
  }

  @Override
  public void clear() {
    final int cleared = size;
    Node.unlinkFrom(head);
    size = 0;
    LOGGER.fine(() -> NAME + " cleared " + cleared + " elements");
  }

  @Override
  public byte[] toJson() throws JsonProcessingException {
    return codec.encode(listValues());
  }

  @Override
  public String toJsonString() throws JsonProcessingException {
    return codec.encodeToString(listValues());
  }

  /// Replace the contents with a JSON array given in push order. The last element of the array ends up on top.
  @Override
  public void fromJson(byte[] json) throws IOException {
    replaceWith(codec.decode(json));
  }

  @Override
  public void fromJson(String json) throws IOException {
    replaceWith(codec.decode(json));
  }

  private void replaceWith(List<T> decoded) {
    clear();
    decoded.forEach(this::push);
    LOGGER.fine(() -> NAME + " refilled from JSON with " + decoded.size() + " elements");
  }

  @Override
  public String toString() {
    try {
      return NAME + ": " + toJsonString();
    } catch (JsonProcessingException e) {
      LOGGER.log(Level.WARNING, e, () -> NAME + " of " + size + " elements could not be rendered as JSON");
      return NAME + ": <" + e.getOriginalMessage() + ">";
    }
  }

  @TestOnly
  Node<T> topNode() {
    return head.next;
  }

  /// Number of value nodes reachable from the sentinel.
  @TestOnly
  int chainLength() {
    int n = 0;
    for (Node<T> x = head.next; x != null; x = x.next) {
      n++;
    }
    return n;
  }
}

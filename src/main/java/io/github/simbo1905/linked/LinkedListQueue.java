// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.linked;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.TestOnly;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;

/// A queue held as a singly linked chain behind a sentinel head node.
///
/// `tail` is the last node of the chain, which is the sentinel itself while the queue is empty. That makes
/// {@link #enqueue(Object)} branch free: the new node always goes after `tail`.
public final class LinkedListQueue<T> implements Queue<T> {

  static final String NAME = "LinkedListQueue";

  private final Node<T> head = new Node<>(null, null); // sentinel, only head.next is used
  private Node<T> tail = head;
  private int size;

  final JsonCodec<T> codec;

  LinkedListQueue(JsonCodec<T> codec) {
    this.codec = codec;
  }

  /// Create an empty queue whose JSON form is handled by the default mapper for the given element class.
  public static <T> LinkedListQueue<T> forClass(Class<T> elementClass) {
    return new LinkedListQueue<>(JsonCodec.forClass(elementClass));
  }

  /// Create an empty queue using a specific codec, for generic element types or a custom mapper.
  public static <T> LinkedListQueue<T> forCodec(JsonCodec<T> codec) {
    Objects.requireNonNull(codec, "codec must not be null");
    return new LinkedListQueue<>(codec);
  }

  /// Create an empty queue of untyped elements.
  public static LinkedListQueue<Object> forAny() {
    return new LinkedListQueue<>(JsonCodec.forAny());
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public void enqueue(@NotNull T value) {
    Objects.requireNonNull(value, "queue elements must not be null");
    tail.next = new Node<>(value, null);
    tail = tail.next;
    size++;
  }

  @Override
  public Optional<T> dequeue() {
    if (size == 0) {
      return Optional.empty();
    }
    final Node<T> x = head.next;
    head.next = x.next;
    x.next = null;
    size--;
    if (size == 0) {
      tail = head;
    }
    return Optional.of(x.value);
  }

  @Override
  public Optional<T> peek() {
    if (size == 0) {
      return Optional.empty();
    }
    return Optional.of(head.next.value);
  }

  /// @return the elements in dequeue order, front first
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
  public void clear() {
    final int cleared = size;
    Node.unlinkFrom(head);
    tail = head;
    size = 0;
    LOGGER.fine(() -> NAME + " cleared " + cleared + " elements");
  }

  @Override
  public byte[] toJson() throws JsonProcessingException {
    return codec.encode(values());
  }

  @Override
  public String toJsonString() throws JsonProcessingException {
    return codec.encodeToString(values());
  }

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
    decoded.forEach(this::enqueue);
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
  boolean tailIsSentinel() {
    return tail == head;
  }

  @TestOnly
  Node<T> firstNode() {
    return head.next;
  }

  @TestOnly
  Node<T> lastNode() {
    return tail;
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

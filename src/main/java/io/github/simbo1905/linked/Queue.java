// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.linked;

import java.util.Optional;

/// A first-in first-out container. Elements are added at the back (tail) and removed from the front (head).
/// {@link #values()} and the JSON form list the elements in dequeue order, front first.
public sealed interface Queue<T> extends Container<T> permits LinkedListQueue {

  /// Add an element at the back of the queue.
  /// @param value the element, must not be null
  void enqueue(T value);

  /// Remove the element at the front of the queue.
  /// @return the removed element or empty if the queue was empty
  Optional<T> dequeue();

  /// The element that the next {@link #dequeue()} would return, without removing it.
  Optional<T> peek();
}

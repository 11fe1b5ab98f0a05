// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.linked;

import java.util.List;
import java.util.Optional;

/// A last-in first-out container. {@link #values()} lists the elements top first while {@link #listValues()} and
/// the JSON form list them in push order, so that a JSON round trip rebuilds the same stack.
public sealed interface Stack<T> extends Container<T> permits LinkedListStack {

  /// Add an element on top of the stack.
  /// @param value the element, must not be null
  void push(T value);

  /// Remove the top element.
  /// @return the removed element or empty if the stack was empty
  Optional<T> pop();

  /// The top element without removing it.
  Optional<T> peek();

  /// @return the elements in push order, the earliest pushed first and the top last
  List<T> listValues();
}

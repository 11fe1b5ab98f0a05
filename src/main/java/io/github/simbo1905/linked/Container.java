// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.linked;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.util.List;
import java.util.logging.Logger;

/// Base contract of the linked containers. A container holds a sequence of non-null elements in insertion order
/// and can render itself as a JSON array and be refilled from one.
///
/// Containers are not thread safe.
public sealed interface Container<T> permits Queue, Stack {

  Logger LOGGER = Logger.getLogger(Container.class.getName());

  /// @return the number of elements, in constant time
  int size();

  default boolean isEmpty() {
    return size() == 0;
  }

  /// A freshly allocated copy of the elements. Later mutations of the container do not affect it.
  /// @return the elements in the natural removal order of the container
  List<T> values();

  /// Encode the container as a JSON array.
  /// @return the UTF-8 bytes of the array
  /// @throws JsonProcessingException if an element cannot be written by the element codec
  byte[] toJson() throws JsonProcessingException;

  /// Same as {@link #toJson()} as a string.
  String toJsonString() throws JsonProcessingException;

  /// Replace the contents with the elements of a JSON array. The whole array is decoded before the container is
  /// touched so any failure leaves it unchanged.
  /// @param json the UTF-8 bytes of a JSON array of elements
  /// @throws IOException the parse or mapping failure reported by Jackson
  void fromJson(byte[] json) throws IOException;

  /// Same as {@link #fromJson(byte[])} from a string.
  void fromJson(String json) throws IOException;

  /// Remove every element.
  void clear();
}

// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.linked;

/// A single link in the chain of a linked container. The sentinel of each container is also a node whose value
/// stays null. Nodes never escape the container that owns them.
final class Node<T> {
  T value;
  Node<T> next;

  Node(T value, Node<T> next) {
    this.value = value;
    this.next = next;
  }

  /// Walks from this node clearing each forward link before advancing, so that a node still referenced from
  /// elsewhere cannot keep its successors reachable.
  static <T> void unlinkFrom(Node<T> start) {
    Node<T> x = start;
    while (x != null) {
      final Node<T> y = x.next;
      x.next = null;
      x = y;
    }
  }
}

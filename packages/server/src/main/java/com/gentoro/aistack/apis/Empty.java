package com.gentoro.aistack.apis;

/** Payload of operations that take no arguments, such as listings. */
public record Empty() {
  public static final Empty INSTANCE = new Empty();
}

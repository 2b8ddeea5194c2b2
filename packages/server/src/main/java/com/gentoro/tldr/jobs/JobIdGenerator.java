package com.gentoro.tldr.jobs;

/** Produces unique, never reused job identifiers. */
@FunctionalInterface
public interface JobIdGenerator {
  String nextId();
}

package io.branchlite.repo;

/** A branch as presented to users: name, commit, and whether HEAD follows it. */
public record Branch(String name, String commit, boolean isCurrent) { }

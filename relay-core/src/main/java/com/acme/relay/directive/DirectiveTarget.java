package com.acme.relay.directive;

/** A validated directive: one action against one repository. */
public record DirectiveTarget(Action action, String repositoryId) {}

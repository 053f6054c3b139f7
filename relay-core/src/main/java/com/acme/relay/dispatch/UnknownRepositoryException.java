package com.acme.relay.dispatch;

/** Directive names a repository the registry has no descriptor for. */
public class UnknownRepositoryException extends DispatchException {
  private final String repositoryId;

  public UnknownRepositoryException(String repositoryId) {
    super("no configuration found for repository: " + repositoryId);
    this.repositoryId = repositoryId;
  }

  public String getRepositoryId() {
    return repositoryId;
  }

  @Override
  public boolean isPermanent() {
    return true;
  }
}

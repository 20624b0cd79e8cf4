package io.github.isoflow.exception;

/**
 * A collaborating service (search index, image store, molecular database service, queue)
 * failed. Collaborator implementations wrap their transport errors in it.
 */
public class UpstreamServiceException extends IsoflowException {

  public UpstreamServiceException(final String message) {
    super(message);
  }

  public UpstreamServiceException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

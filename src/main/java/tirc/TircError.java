package tirc;

import java.util.List;

/** Basic error class in this project. */
public class TircError extends RuntimeException {

  public TircError(Exception wrapped) {
    super(wrapped);
  }

  public TircError(String message) {
    super(message);
  }

  public String getSourceReferencingMessage(List<String> sourceFile) {
    return getMessage();
  }
}

package com.example;

import static java.lang.System.Logger.Level.INFO;

import com.example.keyrotator.core.RotationHandler;
import com.example.keyrotator.core.RotationOutcome;
import java.util.Map;

/** Command-line application running one rotation step against AWS. */
public class App {

  private static final System.Logger LOGGER = System.getLogger(App.class.getName());

  private final RotationHandler handler;

  /**
   * Constructs the application around a handler.
   *
   * @param handler handler that runs the rotation step
   */
  public App(final RotationHandler handler) {
    this.handler = handler;
  }

  /**
   * Entry point. Expects the secret id, the client request token and the step, e.g. {@code
   * my/smtp/secret 3f2a... createSecret}. Configuration is read from the environment.
   *
   * @param args CLI args
   */
  public static void main(final String[] args) {
    if (args.length != 3) {
      System.err.println("usage: App <secretId> <clientRequestToken> <step>");
      System.exit(2);
    }
    final var outcome = new App(new RotationHandler()).run(args[0], args[1], args[2]);
    LOGGER.log(INFO, "Rotation step finished: {0}", outcome);
  }

  /**
   * Runs one step.
   *
   * @param secretId secret ARN or name
   * @param token client request token
   * @param step rotation step
   * @return how the step ended
   */
  public RotationOutcome run(final String secretId, final String token, final String step) {
    return handler.handleRequest(
        Map.of(
            RotationHandler.SECRET_ID, secretId,
            RotationHandler.CLIENT_REQUEST_TOKEN, token,
            RotationHandler.STEP, step));
  }
}

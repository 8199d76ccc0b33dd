package domain.engine;

import java.io.IOException;

/**
 * Boundary to the external statistics engine. One blocking call per fit.
 */
public interface ModelRunner {

    ModelResult run(ModelRequest request) throws IOException, InterruptedException;
}

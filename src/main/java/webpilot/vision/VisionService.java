package webpilot.vision;

import java.io.IOException;

/**
 * Answers a free-form question about a screenshot.
 * Default implementation is StubVisionService (vision disabled).
 */
public interface VisionService {

    /**
     * @param png    screenshot bytes
     * @param prompt what to look for or extract
     * @return the model's textual answer
     * @throws IOException if the endpoint cannot be reached or answers with an error
     */
    String describe(byte[] png, String prompt) throws IOException;
}

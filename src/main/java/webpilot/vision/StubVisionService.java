package webpilot.vision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * No-op VisionService used when vision.enabled=false (the default), so the
 * controller works without an API key.
 */
public class StubVisionService implements VisionService {
    private static final Logger log = LoggerFactory.getLogger(StubVisionService.class);

    static final String DISABLED_MESSAGE =
            "Screenshot analysis is disabled. Set vision.enabled=true and provide an API key to enable it.";

    @Override
    public String describe(byte[] png, String prompt) {
        log.debug("VisionService: stub, vision disabled, ignoring {} byte screenshot", png.length);
        return DISABLED_MESSAGE;
    }
}

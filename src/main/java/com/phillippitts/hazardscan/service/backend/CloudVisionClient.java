package com.phillippitts.hazardscan.service.backend;

/**
 * Transport to the cloud vision service.
 */
public interface CloudVisionClient {

    /**
     * Sends one image and prompt.
     *
     * @param image encoded image bytes
     * @param prompt rendered prompt, already sanitized
     * @param apiKey credential for this call only
     * @return parsed response
     * @throws Exception on transport, HTTP or parse failure
     */
    BackendResponse analyze(byte[] image, String prompt, String apiKey) throws Exception;
}

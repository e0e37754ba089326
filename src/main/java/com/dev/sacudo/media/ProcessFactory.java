package com.dev.sacudo.media;

import java.io.IOException;
import java.util.List;

/**
 * Seam over {@link ProcessBuilder} so process-based backends can be tested with scripted processes.
 */
interface ProcessFactory {

    Process start(List<String> command) throws IOException;
}

package com.todotracker.core.discovery;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Supplies the files a scan visits.
 *
 * <p>Walking the tree, ignore rules and size limits belong to the implementation; the scan
 * core visits exactly the files returned.
 */
public interface FileDiscovery {

    /**
     * Returns the files to scan.
     *
     * @return files in discovery order
     * @throws IOException if the file tree cannot be listed
     */
    List<Path> discover() throws IOException;

    /**
     * Returns the root the files were discovered under.
     */
    Path root();
}

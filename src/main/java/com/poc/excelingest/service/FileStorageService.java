package com.poc.excelingest.service;

import java.io.IOException;
import java.nio.file.Path;

public interface FileStorageService {

    /**
     * Saves byte content to the storage system.
     *
     * @param content  the file data
     * @param fileName relative name, may contain sub-directories
     * @return the location the file was written to
     */
    Path saveFile(byte[] content, String fileName) throws IOException;

    /**
     * Loads a previously saved file.
     */
    byte[] loadFile(String fileName) throws IOException;

    /**
     * Moves a saved file to another relative name, replacing any file already there.
     *
     * @return the new location
     */
    Path moveFile(String fileName, String targetName) throws IOException;
}

package com.autopar.adapter.manifest;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Path;

public class ManifestReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes autopar.json from the given path.
     *
     * @throws ManifestReadException if the file is missing, empty or malformed
     */
    public ManifestConfig read(Path manifestPath) {
        if (!manifestPath.toFile().exists()) {
            throw new ManifestReadException("Config file not found: " + manifestPath);
        }
        try (FileReader reader = new FileReader(manifestPath.toFile())) {
            ManifestConfig config = GSON.fromJson(reader, ManifestConfig.class);
            if (config == null) {
                throw new ManifestReadException("Config file is empty or invalid JSON: " + manifestPath);
            }
            return config;
        } catch (FileNotFoundException e) {
            throw new ManifestReadException("Config file not found: " + manifestPath, e);
        } catch (JsonParseException e) {
            throw new ManifestReadException("Malformed config " + manifestPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ManifestReadException("Failed to read config " + manifestPath + ": " + e.getMessage(), e);
        }
    }

    public static class ManifestReadException extends RuntimeException {
        public ManifestReadException(String message) { super(message); }
        public ManifestReadException(String message, Throwable cause) { super(message, cause); }
    }
}

package com.contractbridge.core;

import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Base class for tests that work on a throwaway repository.
 *
 * <p>Provides a temporary repository root and helpers for writing source files,
 * contracts and configuration into it.
 */
public abstract class RepositoryTestBase {

    @TempDir
    protected Path tempDir;

    /**
     * Creates a file in the temp directory with the given content.
     *
     * @param relativePath path relative to tempDir (e.g., "src/main/java/com/example/UserClient.java")
     * @param content file content
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createFile(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content);
        return filePath;
    }

    /**
     * Creates multiple files from a map of relative paths to content.
     *
     * @param files map of relative path to content
     * @throws IOException if any file cannot be created
     */
    protected void createFiles(Map<String, String> files) throws IOException {
        for (Map.Entry<String, String> entry : files.entrySet()) {
            createFile(entry.getKey(), entry.getValue());
        }
    }

    protected String read(String relativePath) throws IOException {
        return Files.readString(tempDir.resolve(relativePath));
    }

    /**
     * A small user-service contract: list users, get user by id, create user.
     */
    protected static String userServiceContract() {
        return """
            version: "1.0"
            repo_id: user-service
            role: provider
            last_updated: "2024-05-01T10:00:00Z"
            endpoints:
              - id: get-api-users
                path: /api/users
                method: GET
                status: implemented
                response:
                  status: 200
                  type: array
                  items: User
              - id: get-api-users-id
                path: /api/users/{id}
                method: GET
                status: implemented
                parameters:
                  - name: id
                    type: Long
                    required: true
                response:
                  status: 200
                  type: object
                  schema: User
              - id: post-api-users
                path: /api/users
                method: POST
                status: implemented
                response:
                  status: 201
                  type: object
                  schema: User
            models:
              User:
                fields:
                  - name: id
                    type: Long
                  - name: email
                    type: String
            """;
    }
}

package io.codegraph.query;

/**
 * Short reference to an entrypoint node.
 *
 * @param name Display name
 * @param path Path of the entrypoint
 * @param type Detected entrypoint type ({@code route}, {@code command}, ...), {@code unknown} if absent
 */
public record EntrypointRef(String name, String path, String type) {
}

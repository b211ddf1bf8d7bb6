package org.yamldiff.service;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.yamldiff.config.YamlDiffConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Loads YAML content from a local file or an http(s) URL.
 */
@Service
public class ContentLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContentLoader.class);

    private final OkHttpClient httpClient;
    private final YamlDiffConfig.RemoteConfig remoteConfig;

    public ContentLoader(OkHttpClient httpClient, YamlDiffConfig yamlDiffConfig) {
        this.httpClient = httpClient;
        this.remoteConfig = yamlDiffConfig.getRemote();
    }

    public static boolean isRemote(String location) {
        String lower = location.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    public byte[] load(String location) throws IOException {
        if (isRemote(location)) {
            return fetch(location);
        }
        return readFile(location);
    }

    protected byte[] readFile(String location) throws IOException {
        Path path = Paths.get(location);
        if (!Files.exists(path)) {
            throw new IOException("file not found: " + location);
        }
        if (Files.isDirectory(path)) {
            throw new IOException("expected a file but got a directory: " + location);
        }
        byte[] content = Files.readAllBytes(path);
        LOGGER.debug("Read {} bytes from {}", content.length, path);
        return content;
    }

    protected byte[] fetch(String url) throws IOException {
        LOGGER.info("Fetching {}", url);
        Request request = new Request.Builder()
                .url(url)
                .get()
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException(String.format("failed to fetch %s: HTTP %d", url, response.code()));
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("empty response body from " + url);
            }
            return readLimited(body, url);
        }
    }

    private byte[] readLimited(ResponseBody body, String url) throws IOException {
        long limit = remoteConfig.getMaxBytes();
        if (body.contentLength() > limit) {
            throw new IOException(String.format("response from %s exceeds %d bytes", url, limit));
        }
        BufferedSource source = body.source();
        // request() buffers at most limit + 1 bytes; true means the body is larger than the limit
        if (source.request(limit + 1)) {
            throw new IOException(String.format("response from %s exceeds %d bytes", url, limit));
        }
        byte[] content = source.readByteArray();
        LOGGER.debug("Fetched {} bytes from {}", content.length, url);
        return content;
    }
}

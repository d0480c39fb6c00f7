package io.runnermock.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RunnerRelease(
        @JsonProperty("tag_name") String tagName,
        String name,
        List<Asset> assets
) {
    private static final String DOWNLOAD_BASE = "https://github.com/actions/runner/releases/download/";
    private static final long WINDOWS_ASSET_SIZE = 95_000_000L;
    private static final long LINUX_ASSET_SIZE = 180_000_000L;

    /**
     * Release metadata in the shape of the upstream "latest release" payload,
     * with one Windows and one Linux x64 asset.
     */
    public static RunnerRelease forVersion(String version) {
        String tag = "v" + version;
        String windows = "actions-runner-win-x64-" + version + ".zip";
        String linux = "actions-runner-linux-x64-" + version + ".tar.gz";
        return new RunnerRelease(tag, tag, List.of(
                new Asset(windows, DOWNLOAD_BASE + tag + "/" + windows, WINDOWS_ASSET_SIZE),
                new Asset(linux, DOWNLOAD_BASE + tag + "/" + linux, LINUX_ASSET_SIZE)
        ));
    }

    public record Asset(
            String name,
            @JsonProperty("browser_download_url") String browserDownloadUrl,
            long size
    ) {
    }
}

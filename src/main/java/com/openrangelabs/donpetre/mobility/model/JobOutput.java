package com.openrangelabs.donpetre.mobility.model;

/**
 * Where a successful vendor job left its output
 */
public record JobOutput(String bucket, String prefix) {

    /**
     * Normalises a vendor folder path into a list prefix: no leading slash, exactly one trailing slash.
     */
    public static JobOutput of(String bucket, String folderPath) {
        String prefix = folderPath == null ? "" : folderPath.trim();
        while (prefix.startsWith("/")) {
            prefix = prefix.substring(1);
        }
        if (!prefix.isEmpty() && !prefix.endsWith("/")) {
            prefix = prefix + "/";
        }
        return new JobOutput(bucket, prefix);
    }

    public String uri() {
        return "s3://" + bucket + "/" + prefix;
    }
}

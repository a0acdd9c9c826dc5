package com.github.ytdle.model;

public enum MediaFormat {
    AUDIO("mp3"),
    VIDEO("mp4");

    private final String extension;

    MediaFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}

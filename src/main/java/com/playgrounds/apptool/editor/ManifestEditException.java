package com.playgrounds.apptool.editor;

/**
 * An edit that cannot be carried out on the given manifest.
 */
public class ManifestEditException extends Exception {

    public ManifestEditException(String message) {
        super(message);
    }
}

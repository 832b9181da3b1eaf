package com.playgrounds.apptool.editor;

public class TargetNotFoundException extends ManifestEditException {

    public TargetNotFoundException(String message) {
        super(message);
    }
}

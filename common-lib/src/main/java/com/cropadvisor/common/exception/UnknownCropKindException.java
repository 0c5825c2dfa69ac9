package com.cropadvisor.common.exception;

public class UnknownCropKindException extends AdvisoryException {
    private final String cropKey;

    public UnknownCropKindException(String cropKey) {
        super("CropKnowledgeBase", "no phenology for crop '" + cropKey + "'");
        this.cropKey = cropKey;
    }

    public String getCropKey() {
        return cropKey;
    }
}

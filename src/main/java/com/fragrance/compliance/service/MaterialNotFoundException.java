package com.fragrance.compliance.service;

public class MaterialNotFoundException extends RuntimeException {

    public MaterialNotFoundException(String key) {
        super("Material not found: " + key);
    }
}

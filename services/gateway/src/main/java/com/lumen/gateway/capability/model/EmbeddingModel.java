package com.lumen.gateway.capability.model;

public interface EmbeddingModel {

    float[] embed(String text);
}

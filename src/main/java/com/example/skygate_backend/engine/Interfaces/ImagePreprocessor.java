package com.example.skygate_backend.engine.Interfaces;

import com.example.skygate_backend.engine.model.ImageTensor;

import java.awt.image.BufferedImage;

public interface ImagePreprocessor {
    ImageTensor apply(BufferedImage image);

    String describe();
}

package com.example.wheelcodereader.service.ocr;

import com.example.wheelcodereader.model.ObservationResult;
import java.awt.image.BufferedImage;

/**
 * One OCR engine call over a whole image. Implementations may be local or
 * remote; the recognizer treats them identically once observations arrive.
 * Engine failures are reported through {@link ObservationResult#failure}
 * rather than thrown.
 */
public interface TextObserver {

    String name();

    ObservationResult observe(BufferedImage image);
}

package com.project.image.anomalies.DTOs;

import org.opencv.core.Mat;

/** One input image together with the name it is reported under. */
public record Frame(String id, Mat pixels) {}

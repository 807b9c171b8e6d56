package com.project.image.anomalies.controller;

import com.project.image.anomalies.config.AnomalyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Public landing page, showing the pipeline settings the service currently runs with.
 */
@Controller
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    private final AnomalyProperties properties;

    public HomeController(AnomalyProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/")
    public String index(Model model) {
        log.debug("Serving home page");
        model.addAttribute("scaleFactor", properties.getPreprocess().getScaleFactor());
        model.addAttribute("sampleCount", properties.getGolden().getSampleCount());
        model.addAttribute("roiPolicy", properties.getRoi().getPolicy());
        model.addAttribute("diffThreshold", properties.getAnomaly().getDiffThreshold());
        return "index";
    }
}

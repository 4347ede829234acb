package com.tradeingest.api.controller;

import com.tradeingest.domain.model.BrokerFormat;
import com.tradeingest.exception.ResourceNotFoundException;
import com.tradeingest.format.FormatRepository;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Read-only view of the format registry: seeded broker formats followed by learned ones. */
@RestController
@RequestMapping("/api/formats")
public class FormatController {

    private final FormatRepository formatRepository;

    public FormatController(FormatRepository formatRepository) {
        this.formatRepository = formatRepository;
    }

    @GetMapping
    public List<BrokerFormat> list() {
        return formatRepository.list();
    }

    @GetMapping("/{id}")
    public BrokerFormat get(@PathVariable String id) {
        return formatRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("BrokerFormat", id));
    }
}

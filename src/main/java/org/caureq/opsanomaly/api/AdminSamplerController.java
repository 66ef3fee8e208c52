package org.caureq.opsanomaly.api;

import lombok.RequiredArgsConstructor;
import org.caureq.opsanomaly.service.SamplerService;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin/sampler")
@RequiredArgsConstructor
public class AdminSamplerController {
    private final SamplerService sampler;

    @GetMapping
    public SamplerService.SamplerStatus status() { return sampler.status(); }

    @PostMapping("/cancel")
    public SamplerService.SamplerStatus cancel() {
        sampler.cancel();
        return sampler.status();
    }

    @PostMapping("/resume")
    public SamplerService.SamplerStatus resume() {
        sampler.resume();
        return sampler.status();
    }
}

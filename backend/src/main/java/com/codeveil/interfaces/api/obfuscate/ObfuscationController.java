package com.codeveil.interfaces.api.obfuscate;

import com.codeveil.application.obfuscation.ObfuscationAppService;
import com.codeveil.domain.obfuscation.model.ObfuscationConfig;
import com.codeveil.domain.obfuscation.model.PipelineResult;
import com.codeveil.infrastructure.obfuscation.config.ObfuscationConfigLoader;
import com.codeveil.interfaces.api.dto.ObfuscateRequest;
import com.codeveil.interfaces.api.dto.ObfuscateResponse;
import com.codeveil.interfaces.api.dto.TechniqueInfoResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/obfuscate")
@RequiredArgsConstructor
public class ObfuscationController {

    private final ObfuscationAppService obfuscationAppService;
    private final ObfuscationConfigLoader configLoader;

    @PostMapping
    public ResponseEntity<ObfuscateResponse> obfuscate(@Valid @RequestBody ObfuscateRequest request,
                                                       @RequestParam(defaultValue = "false") boolean verbose) {
        ObfuscationConfig config = configLoader.applyOverrides(configLoader.defaults(), request.toOverrides());

        PipelineResult result = obfuscationAppService.obfuscate(
                request.source(),
                request.fileName(),
                request.language(),
                config);

        return ResponseEntity.ok(ObfuscateResponse.from(result, verbose));
    }

    @GetMapping("/techniques")
    public ResponseEntity<List<TechniqueInfoResponse>> listTechniques() {
        return ResponseEntity.ok(obfuscationAppService.listTechniques().stream()
                .map(TechniqueInfoResponse::from)
                .toList());
    }
}

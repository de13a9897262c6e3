package com.lumen.gateway.api;

import com.lumen.gateway.capability.model.ModelKind;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.operation.DiagnosticsOperations;
import com.lumen.gateway.operation.ModelHealth;
import com.lumen.gateway.operation.ServerInfo;
import com.lumen.security.License;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class DiagnosticsController {

    private final DiagnosticsOperations operations;

    public DiagnosticsController(DiagnosticsOperations operations) {
        this.operations = operations;
    }

    @GetMapping("/server-info")
    public ServerInfo serverInfo(RequestContext ctx) {
        return operations.serverInfo(ctx);
    }

    @GetMapping("/models/{kind}/health")
    public ModelHealth testModelConnection(RequestContext ctx, @PathVariable ModelKind kind) {
        return operations.testModelConnection(ctx, kind);
    }

    @GetMapping("/license")
    public License license(RequestContext ctx) {
        return operations.license(ctx);
    }

    @PutMapping("/license")
    public boolean uploadLicense(RequestContext ctx, @RequestBody LicenseRequest request) {
        return operations.uploadLicense(ctx, request.license());
    }

    @DeleteMapping("/license")
    public boolean resetLicense(RequestContext ctx) {
        return operations.resetLicense(ctx);
    }

    public record LicenseRequest(String license) {
    }
}

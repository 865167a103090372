package com.example.sgkdocumentreader.controller;

import com.example.sgkdocumentreader.model.Patient;
import com.example.sgkdocumentreader.model.WorkflowUpdateRequest;
import com.example.sgkdocumentreader.service.PatientWorkflowService;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/patients")
public class PatientController {

    private final PatientWorkflowService workflowService;

    public PatientController(PatientWorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @Operation(summary = "List patients with their SGK workflow state")
    @GetMapping
    public List<Patient> list() {
        return workflowService.listPatients();
    }

    @Operation(summary = "Get one patient")
    @GetMapping("/{id}")
    public Patient get(@PathVariable("id") String id) {
        return workflowService.getPatient(id);
    }

    @Operation(
            summary = "Set the SGK workflow status of a patient",
            description = "Appends to the status history and moves the patient's documents forward to the status.")
    @PostMapping(value = "/{id}/workflow", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Patient setWorkflowStatus(@PathVariable("id") String id,
                                     @Valid @RequestBody WorkflowUpdateRequest request) {
        return workflowService.setStatus(id, request.status(), request.note());
    }
}

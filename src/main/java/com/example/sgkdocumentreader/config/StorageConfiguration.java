package com.example.sgkdocumentreader.config;

import com.example.sgkdocumentreader.exception.PersistenceException;
import com.example.sgkdocumentreader.model.Patient;
import com.example.sgkdocumentreader.service.storage.ArtifactStore;
import com.example.sgkdocumentreader.service.storage.JsonFileArtifactStore;
import com.example.sgkdocumentreader.service.storage.JsonPatientDirectory;
import com.example.sgkdocumentreader.service.storage.PatientDirectory;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;

@Configuration
public class StorageConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StorageConfiguration.class);

    @Bean
    public ArtifactStore artifactStore(PipelineProperties properties, ObjectMapper objectMapper) {
        PipelineProperties.Storage storage = properties.getStorage();
        return new JsonFileArtifactStore(Paths.get(storage.getDirectory()), storage.getQuotaBytes(), objectMapper);
    }

    @Bean
    public PatientDirectory patientDirectory(PipelineProperties properties, ObjectMapper objectMapper,
                                             Clock clock, ResourceLoader resourceLoader) {
        Path file = Paths.get(properties.getStorage().getDirectory()).resolve("patients.json");
        List<Patient> seed = loadSeed(properties.getStorage().getPatientsSeed(), objectMapper, resourceLoader);
        return new JsonPatientDirectory(file, objectMapper, clock, seed);
    }

    static List<Patient> loadSeed(String location, ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        if (location == null || location.isBlank()) {
            return List.of();
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Patient seed {} not found, starting with an empty directory", location);
            return List.of();
        }
        try (InputStream input = resource.getInputStream()) {
            List<Patient> patients = objectMapper.readValue(input, new TypeReference<List<Patient>>() {
            });
            log.info("Loaded {} patient(s) from seed {}", patients.size(), location);
            return patients;
        } catch (IOException ex) {
            log.error("Unable to read patient seed {}", location, ex);
            throw new PersistenceException("Unable to read patient seed " + location, ex);
        }
    }
}

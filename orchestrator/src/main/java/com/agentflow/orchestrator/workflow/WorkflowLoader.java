package com.agentflow.orchestrator.workflow;

import com.agentflow.orchestrator.model.WorkflowDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Loads workflow definitions (JSON) by name.
 *
 * Sources, in order: {@code agentflow.workflows.location} (classpath
 * pattern) and, when set, every {@code *.json} in
 * {@code agentflow.workflows.dir}. A workflow's name is its "name" field,
 * or the file's base name when the field is absent.
 *
 * Files are read on every call: definitions are loaded once per invocation
 * and edits are picked up without a restart.
 */
@Component
public class WorkflowLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkflowLoader.class);

    private final ObjectMapper            json;
    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
    private final String                  location;
    private final String                  directory;

    public WorkflowLoader(ObjectMapper objectMapper,
                          @Value("${agentflow.workflows.location:classpath*:workflows/*.json}") String location,
                          @Value("${agentflow.workflows.dir:}") String directory) {
        this.json      = objectMapper;
        this.location  = location;
        this.directory = directory == null ? "" : directory.trim();
    }

    /**
     * Load a workflow by name, or from a file when {@code nameOrPath} points
     * at an existing {@code .json} file.
     *
     * @throws WorkflowNotFoundException   no source defines that name
     * @throws WorkflowDefinitionException the matching file is malformed
     */
    public WorkflowDefinition load(String nameOrPath) {
        Path asPath = Path.of(nameOrPath);
        if (nameOrPath.endsWith(".json") && Files.isRegularFile(asPath)) {
            return validated(parse(new FileSystemResource(asPath)));
        }

        for (Resource resource : resources()) {
            WorkflowDefinition wf;
            try {
                wf = parse(resource);
            } catch (WorkflowDefinitionException e) {
                if (baseName(resource).equals(nameOrPath)) {
                    throw e;
                }
                log.warn("Skipping unreadable workflow {}: {}", resource.getDescription(), e.getMessage());
                continue;
            }
            if (wf.name().equals(nameOrPath)) {
                return validated(wf);
            }
        }
        throw new WorkflowNotFoundException(nameOrPath);
    }

    /** All loadable workflows keyed by name (sorted); unreadable files are logged and left out. */
    public Map<String, WorkflowDefinition> all() {
        Map<String, WorkflowDefinition> byName = new TreeMap<>();
        for (Resource resource : resources()) {
            try {
                WorkflowDefinition wf = parse(resource);
                byName.putIfAbsent(wf.name(), wf);
            } catch (WorkflowDefinitionException e) {
                log.warn("Skipping unreadable workflow {}: {}", resource.getDescription(), e.getMessage());
            }
        }
        return byName;
    }

    public List<String> names() {
        return List.copyOf(all().keySet());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private List<Resource> resources() {
        List<Resource> found = new ArrayList<>();
        try {
            found.addAll(Arrays.asList(resolver.getResources(location)));
            if (!directory.isEmpty()) {
                found.addAll(Arrays.asList(resolver.getResources(
                        "file:" + Path.of(directory).toAbsolutePath() + "/*.json")));
            }
        } catch (IOException e) {
            throw new WorkflowDefinitionException("Cannot list workflow sources", e);
        }
        return found;
    }

    private WorkflowDefinition parse(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            WorkflowDefinition wf = json.readValue(in, WorkflowDefinition.class);
            if (wf == null) {
                throw new WorkflowDefinitionException("Empty workflow file " + resource.getDescription());
            }
            return (wf.name() == null || wf.name().isBlank()) ? wf.named(baseName(resource)) : wf;
        } catch (IOException e) {
            throw new WorkflowDefinitionException(
                    "Malformed workflow " + resource.getDescription() + ": " + e.getMessage(), e);
        }
    }

    private static WorkflowDefinition validated(WorkflowDefinition wf) {
        WorkflowValidator.validate(wf);
        return wf;
    }

    private static String baseName(Resource resource) {
        String file = resource.getFilename() == null ? "" : resource.getFilename();
        return file.endsWith(".json") ? file.substring(0, file.length() - ".json".length()) : file;
    }
}

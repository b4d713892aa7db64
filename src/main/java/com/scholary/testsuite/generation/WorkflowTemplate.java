package com.scholary.testsuite.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.testsuite.suite.GenerationSettings;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * Text-to-image workflow graph sent to the generator.
 *
 * <p>The template is loaded once and copied for every request; only node inputs are patched. Node
 * ids are fixed by the template file:
 *
 * <ul>
 *   <li>1: base model loader
 *   <li>6: prompt encoder
 *   <li>16: sampler, 17: scheduler (steps, denoise)
 *   <li>25: noise seed, 26: guidance
 *   <li>27, 30: latent and sampling resolution
 *   <li>43: adapter loader with ten slots
 * </ul>
 */
@Component
public class WorkflowTemplate {

  static final int ADAPTER_SLOTS = 10;

  private final ObjectNode workflow;
  private final String baseModelName;

  @Autowired
  public WorkflowTemplate(ObjectMapper objectMapper, GenerationProperties properties) {
    this(load(objectMapper, properties.workflowTemplate()), properties.baseModelName());
  }

  WorkflowTemplate(ObjectNode workflow, String baseModelName) {
    this.workflow = workflow;
    this.baseModelName = baseModelName;
  }

  /**
   * Build the workflow for one image.
   *
   * @throws GenerationException if the template lacks a node this method patches
   */
  public ObjectNode build(GenerationRequest request) {
    GenerationSettings settings = request.settings();
    ObjectNode graph = workflow.deepCopy();

    inputs(graph, "1").put("unet_name", baseModelName + ".safetensors");
    inputs(graph, "6").put("text", request.prompt());
    inputs(graph, "25").put("noise_seed", request.seed());
    inputs(graph, "16").put("sampler_name", settings.samplerName());

    ObjectNode scheduler = inputs(graph, "17");
    scheduler.put("scheduler", settings.schedulerName());
    scheduler.put("steps", settings.steps());
    scheduler.put("denoise", settings.denoise());

    inputs(graph, "26").put("guidance", settings.guidance());

    ObjectNode latent = inputs(graph, "27");
    latent.put("width", settings.width());
    latent.put("height", settings.height());
    latent.put("batch_size", 1);

    ObjectNode sampling = inputs(graph, "30");
    sampling.put("width", settings.width());
    sampling.put("height", settings.height());

    ObjectNode adapters = inputs(graph, "43");
    adapters.put("num_loras", 1);
    adapters.put("lora_1_name", request.model().loraFilename());
    adapters.put("lora_1_strength", settings.loraWeight());
    adapters.put("lora_1_model_strength", settings.loraWeight());
    adapters.put("lora_1_clip_strength", settings.loraWeight());
    for (int slot = 2; slot <= ADAPTER_SLOTS; slot++) {
      adapters.put("lora_" + slot + "_name", "None");
      adapters.put("lora_" + slot + "_strength", 1);
      adapters.put("lora_" + slot + "_model_strength", 1);
      adapters.put("lora_" + slot + "_clip_strength", 1);
    }

    return graph;
  }

  private static ObjectNode inputs(ObjectNode graph, String nodeId) {
    JsonNode inputs = graph.path(nodeId).path("inputs");
    if (!inputs.isObject()) {
      throw new GenerationException("Workflow template has no inputs for node " + nodeId);
    }
    return (ObjectNode) inputs;
  }

  private static ObjectNode load(ObjectMapper objectMapper, String location) {
    Resource resource = new DefaultResourceLoader().getResource(location);
    try (InputStream in = resource.getInputStream()) {
      JsonNode root = objectMapper.readTree(in);
      JsonNode graph = root.has("workflow") ? root.get("workflow") : root;
      if (!graph.isObject()) {
        throw new IllegalStateException("Workflow template is not a JSON object: " + location);
      }
      return (ObjectNode) graph;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load workflow template: " + location, e);
    }
  }
}

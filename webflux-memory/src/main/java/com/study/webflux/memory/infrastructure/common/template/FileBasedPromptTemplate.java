package com.study.webflux.memory.infrastructure.common.template;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

/**
 * classpath의 {@code templates/} 아래 프롬프트 파일을 읽어 {@code {{name}}} 자리표시자를 치환합니다.
 */
@Component
public class FileBasedPromptTemplate {

	private static final List<String> TEMPLATE_EXTENSIONS = List.of(".md", ".txt");

	private final Map<String, String> templateCache = new ConcurrentHashMap<>();

	public String load(String templateName) {
		return load(templateName, Map.of());
	}

	public String load(String templateName, Map<String, String> variables) {
		String result = templateCache.computeIfAbsent(templateName, this::read);
		for (Map.Entry<String, String> entry : variables.entrySet()) {
			String value = entry.getValue() == null ? "" : entry.getValue();
			result = result.replace("{{" + entry.getKey() + "}}", value);
		}
		return result;
	}

	private String read(String templateName) {
		ClassPathResource resource = resolveResource(templateName);
		try {
			return StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new IllegalStateException("Failed to load template: " + templateName, e);
		}
	}

	private ClassPathResource resolveResource(String templateName) {
		for (String ext : TEMPLATE_EXTENSIONS) {
			ClassPathResource resource = new ClassPathResource("templates/" + templateName + ext);
			if (resource.exists()) {
				return resource;
			}
		}
		throw new IllegalStateException("Template not found for name: " + templateName);
	}
}

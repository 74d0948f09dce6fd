package com.study.webflux.memory.domain.dialogue.model;

public enum MessageRole {
	SYSTEM, USER, ASSISTANT
}

package org.javai.springai.intent.oracle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.intent.store.Role;
import org.javai.springai.intent.store.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;

/**
 * {@link LanguageOracle} backed by a Spring AI {@link ChatClient}.
 *
 * <p>History turns become user and assistant messages ahead of the current
 * utterance. Any runtime failure of the client is reported as
 * {@link OracleUnavailableException}; an empty answer as
 * {@link OracleProtocolException}.</p>
 */
public class ChatClientOracle implements LanguageOracle {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientOracle.class);

	private final ChatClient chatClient;
	private final String modelId;

	public ChatClientOracle(ChatClient chatClient) {
		this(chatClient, null);
	}

	/**
	 * @param chatClient the Spring AI ChatClient
	 * @param modelId identifier reported when the provider does not name its model
	 */
	public ChatClientOracle(ChatClient chatClient, String modelId) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.modelId = modelId;
	}

	@Override
	@SuppressWarnings("null")
	public OracleResponse complete(OracleRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		ChatResponse chatResponse;
		try {
			ChatClient.ChatClientRequestSpec spec = chatClient.prompt();
			if (!request.systemPrompt().isBlank()) {
				spec.system(request.systemPrompt());
			}
			if (!request.history().isEmpty()) {
				spec.messages(toMessages(request.history()));
			}
			spec.user(request.userText());
			spec.options(toChatOptions(request.options()));
			logger.debug("Oracle request: {} history message(s), user text of {} chars",
					request.history().size(), request.userText().length());
			chatResponse = spec.call().chatResponse();
		} catch (RuntimeException e) {
			throw new OracleUnavailableException("Chat client call failed: " + e.getMessage(), e);
		}

		String content = extractText(chatResponse);
		if (content == null || content.isBlank()) {
			throw new OracleProtocolException("Oracle returned an empty response", content);
		}
		ChatResponseMetadata metadata = chatResponse.getMetadata();
		return new OracleResponse(content, usageOf(metadata), modelOf(metadata));
	}

	static List<Message> toMessages(List<Turn> history) {
		List<Message> messages = new ArrayList<>(history.size());
		for (Turn turn : history) {
			if (turn.role() == Role.HUMAN) {
				messages.add(new UserMessage(turn.content()));
			} else {
				messages.add(new AssistantMessage(turn.content()));
			}
		}
		return messages;
	}

	private static ChatOptions toChatOptions(OracleOptions options) {
		ChatOptions.Builder builder = ChatOptions.builder();
		if (options.temperature() != null) {
			builder.temperature(options.temperature());
		}
		if (options.maxTokens() != null) {
			builder.maxTokens(options.maxTokens());
		}
		return builder.build();
	}

	private static String extractText(ChatResponse chatResponse) {
		if (chatResponse == null || chatResponse.getResult() == null || chatResponse.getResult().getOutput() == null) {
			return null;
		}
		return chatResponse.getResult().getOutput().getText();
	}

	private static Map<String, Object> usageOf(ChatResponseMetadata metadata) {
		Map<String, Object> usage = new LinkedHashMap<>();
		if (metadata == null || metadata.getUsage() == null) {
			return usage;
		}
		Usage reported = metadata.getUsage();
		putIfPresent(usage, "prompt_tokens", reported.getPromptTokens());
		putIfPresent(usage, "completion_tokens", reported.getCompletionTokens());
		putIfPresent(usage, "total_tokens", reported.getTotalTokens());
		return usage;
	}

	private static void putIfPresent(Map<String, Object> target, String key, Integer value) {
		if (value != null && value > 0) {
			target.put(key, value);
		}
	}

	private String modelOf(ChatResponseMetadata metadata) {
		if (metadata != null && metadata.getModel() != null && !metadata.getModel().isBlank()) {
			return metadata.getModel();
		}
		return modelId;
	}
}

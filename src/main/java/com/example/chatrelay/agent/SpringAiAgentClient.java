package com.example.chatrelay.agent;

import com.example.chatrelay.model.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.advisor.MessageChatMemoryAdvisor;
import org.springframework.ai.chat.client.advisor.api.Advisor;
import org.springframework.ai.chat.memory.ChatMemory;
import org.springframework.ai.chat.memory.ChatMemoryRepository;
import org.springframework.ai.chat.memory.MessageWindowChatMemory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Service;
import org.springframework.util.MimeType;
import org.springframework.util.MimeTypeUtils;

import java.util.List;
import java.util.Map;

/**
 * Agent boundary backed by a Spring AI {@link ChatClient}.
 *
 * <p>The client is built on first use and then reused for the life of the process. A
 * {@link ChatModel} bean wins if one exists; otherwise an OpenAI model is built from
 * {@code chatrelay.agent.*}. Without either, every call fails with
 * {@link AgentResult.ErrorKind#NOT_CONFIGURED}.
 *
 * <p>Text turns go through a per-session memory window. Audio turns see that history but are
 * remembered as {@code [Audio Message]}, so no media is replayed on later turns. The caller's
 * user id is passed to tools as {@link AgentRequest#CALLER_ID}.
 */
@Service
public class SpringAiAgentClient implements AgentClient {

    private static final Logger logger = LoggerFactory.getLogger(SpringAiAgentClient.class);

    private final ObjectProvider<ChatModel> chatModels;
    private final ObjectProvider<ToolCallbackProvider> toolCallbacks;
    private final ChatMemoryRepository memoryRepository;
    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final String audioModel;
    private final String systemPrompt;
    private final int memoryWindow;

    private final Object initLock = new Object();
    private volatile AgentRuntime runtime;

    public SpringAiAgentClient(ObjectProvider<ChatModel> chatModels,
                               ObjectProvider<ToolCallbackProvider> toolCallbacks,
                               ChatMemoryRepository memoryRepository,
                               @Value("${chatrelay.agent.api-key:}") String apiKey,
                               @Value("${chatrelay.agent.base-url:}") String baseUrl,
                               @Value("${chatrelay.agent.model:gpt-4o-mini}") String model,
                               @Value("${chatrelay.agent.audio-model:}") String audioModel,
                               @Value("${chatrelay.agent.system-prompt:}") String systemPrompt,
                               @Value("${chatrelay.agent.memory-window:12}") int memoryWindow) {
        this.chatModels = chatModels;
        this.toolCallbacks = toolCallbacks;
        this.memoryRepository = memoryRepository;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.baseUrl = baseUrl == null ? "" : baseUrl.trim();
        this.model = model;
        this.audioModel = audioModel == null ? "" : audioModel.trim();
        this.systemPrompt = systemPrompt == null ? "" : systemPrompt.trim();
        this.memoryWindow = memoryWindow;
    }

    @Override
    public AgentResult invoke(AgentRequest request) {
        try {
            AgentRuntime agent = runtime();
            if (agent == null) {
                return AgentResult.failure(AgentResult.ErrorKind.NOT_CONFIGURED, "No chat model configured");
            }

            String conversationId = request.getSessionId();
            String callerId = request.getUserId() == null ? "" : request.getUserId();
            ChatClient.ChatClientRequestSpec spec = agent.client.prompt()
                    .toolContext(Map.of(AgentRequest.CALLER_ID, callerId));
            if (request.hasAudio()) {
                // audio bytes never enter the memory window; earlier turns are replayed as text
                MimeType mimeType = MimeTypeUtils.parseMimeType(request.getAudioContentType());
                ByteArrayResource audio = new ByteArrayResource(request.getAudio());
                spec = spec.messages(agent.memory.get(conversationId))
                        .user(u -> u.text(request.getText()).media(mimeType, audio));
                if (!audioModel.isBlank()) {
                    spec = spec.options(ToolCallingChatOptions.builder().model(audioModel).build());
                }
            } else {
                spec = spec.advisors(agent.memoryAdvisor)
                        .advisors(a -> a.param(ChatMemory.CONVERSATION_ID, conversationId))
                        // user(String) rejects whitespace-only text, which is a valid turn here
                        .messages(new UserMessage(request.getText()));
            }

            String content = spec.call().content();
            if (content == null || content.isBlank()) {
                logger.warn("Agent returned an empty reply for {}", request.getUserId());
                return AgentResult.failure(AgentResult.ErrorKind.EMPTY_REPLY, "Agent returned an empty reply");
            }
            if (request.hasAudio()) {
                agent.memory.add(conversationId, List.of(
                        new UserMessage(ChatMessage.AUDIO_PLACEHOLDER), new AssistantMessage(content)));
            }
            return AgentResult.success(content);
        } catch (Exception e) {
            logger.error("Agent error for user {} in session {}", request.getUserId(), request.getSessionId(), e);
            return AgentResult.failure(AgentResult.ErrorKind.UPSTREAM, e.getMessage());
        }
    }

    private AgentRuntime runtime() {
        AgentRuntime local = runtime;
        if (local != null) {
            return local;
        }
        synchronized (initLock) {
            if (runtime == null) {
                ChatModel chatModel = chatModels.getIfAvailable(this::createOpenAiModel);
                if (chatModel == null) {
                    return null;
                }
                ChatMemory memory = MessageWindowChatMemory.builder()
                        .chatMemoryRepository(memoryRepository)
                        .maxMessages(memoryWindow)
                        .build();
                ChatClient.Builder builder = ChatClient.builder(chatModel);
                if (!systemPrompt.isBlank()) {
                    builder.defaultSystem(systemPrompt);
                }
                ToolCallbackProvider tools = toolCallbacks.getIfAvailable();
                if (tools != null) {
                    builder.defaultToolCallbacks(tools);
                }
                runtime = new AgentRuntime(builder.build(), memory, MessageChatMemoryAdvisor.builder(memory).build());
                logger.info("Agent client initialized with {}", chatModel.getClass().getSimpleName());
            }
            return runtime;
        }
    }

    private ChatModel createOpenAiModel() {
        if (apiKey.isBlank()) {
            logger.warn("Agent API key is not set; agent calls will fail");
            return null;
        }
        var apiBuilder = OpenAiApi.builder().apiKey(apiKey);
        if (!baseUrl.isBlank()) apiBuilder.baseUrl(baseUrl);

        return OpenAiChatModel.builder()
                .openAiApi(apiBuilder.build())
                .defaultOptions(OpenAiChatOptions.builder().model(model).build())
                .build();
    }

    private static final class AgentRuntime {
        final ChatClient client;
        final ChatMemory memory;
        final Advisor memoryAdvisor;

        AgentRuntime(ChatClient client, ChatMemory memory, Advisor memoryAdvisor) {
            this.client = client;
            this.memory = memory;
            this.memoryAdvisor = memoryAdvisor;
        }
    }
}

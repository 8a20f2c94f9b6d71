package com.example.chatrelay.agent;

public interface AgentClient {
    AgentResult invoke(AgentRequest request);
}

package com.openforge.helium.chat;

import com.openforge.helium.chat.dto.ChatRequestDto;
import com.openforge.helium.chat.dto.ChatResponseDto;
import com.openforge.helium.mcp.ToolCatalog;
import com.openforge.helium.mcp.model.BackendStatus;
import com.openforge.helium.mcp.model.ToolDescriptor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Chat and tool discovery endpoints.
 *
 *   POST /api/chat          : run one request through the tool loop (blocking)
 *   GET  /api/tools         : tools currently offered to the model
 *   POST /api/tools/refresh : re-run tools/list against the MCP server
 *   GET  /api/tools/status  : whether the MCP server is up, and its tool count
 *
 * Subscribe to /topic/chat/{sessionId} before posting to see progress live.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ChatController {

    private final ChatService chatService;
    private final ToolCatalog toolCatalog;

    @PostMapping("/chat")
    public ResponseEntity<ChatResponseDto> chat(@Valid @RequestBody ChatRequestDto request) {
        return ResponseEntity.ok(chatService.chat(request));
    }

    @GetMapping("/tools")
    public ResponseEntity<List<ToolDescriptor>> tools() {
        return ResponseEntity.ok(toolCatalog.tools());
    }

    @GetMapping("/tools/status")
    public ResponseEntity<BackendStatus> toolStatus() {
        return ResponseEntity.ok(toolCatalog.status());
    }

    @PostMapping("/tools/refresh")
    public ResponseEntity<List<ToolDescriptor>> refreshTools() {
        return ResponseEntity.ok(toolCatalog.refresh());
    }
}

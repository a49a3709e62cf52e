package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;

/**
 * Result of a single tool execution (real or synthetic).
 *
 * @param toolCallId
 *            tool_call_id as provided by the LLM
 * @param toolName
 *            tool name (as used in history)
 * @param toolResult
 *            raw ToolResult (success/failure + failure kind)
 * @param messageContent
 *            content to write into the "tool" message
 * @param synthetic
 *            whether this result was produced without a tool answer
 */
public record ToolExecutionOutcome(String toolCallId,String toolName,ToolResult toolResult,String messageContent,boolean synthetic){

public static ToolExecutionOutcome of(Message.ToolCall toolCall,ToolResult result){String content=result.getOutput()!=null?result.getOutput():"";return new ToolExecutionOutcome(toolCall.getId(),toolCall.getName(),result,content,false);}

public static ToolExecutionOutcome synthetic(Message.ToolCall toolCall,ToolFailureKind kind,String reason){return new ToolExecutionOutcome(toolCall.getId(),toolCall.getName(),ToolResult.failure(kind,reason),reason,true);}}

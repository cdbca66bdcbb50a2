package com.gentoro.gscmcp.tools;

/** Serialized result of a tool call; {@code error} marks a failed call. */
public record ToolResponse(String content, boolean error) {}

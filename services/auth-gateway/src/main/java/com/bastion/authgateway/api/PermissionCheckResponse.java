package com.bastion.authgateway.api;

import java.util.List;

/**
 * @param actions the requested action names
 * @param granted whether the current identity holds all of them
 */
public record PermissionCheckResponse(List<String> actions, boolean granted) {}

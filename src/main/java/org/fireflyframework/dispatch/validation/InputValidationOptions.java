/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.fireflyframework.dispatch.validation;

/**
 * Settings of {@link InputValidationMiddleware} and of the built-in validators.
 * Bound under {@code firefly.dispatch.validation}.
 */
public class InputValidationOptions {

    /**
     * Turning validation off is meant for development only; every bypassed dispatch logs a warning.
     */
    private boolean enabled = true;

    /**
     * When set, the correlation id must be a non-nil UUID.
     */
    private boolean requireCorrelationId = true;

    private int maxMessageAgeDays = 7;

    /**
     * Whether an exception thrown by a validator counts as a validation error
     * or is only logged.
     */
    private boolean failOnValidatorException = true;

    private boolean blockSqlInjection = true;
    private boolean blockNoSqlInjection = true;
    private boolean blockCommandInjection = false;
    private boolean blockPathTraversal = true;
    private boolean blockLdapInjection = false;
    private boolean blockHtmlContent = true;
    private boolean blockControlCharacters = true;

    /** Maximum length of any string value, 0 disables the check. */
    private int maxStringLength = 10_000;

    /** Maximum serialized size in bytes, 0 disables the check. */
    private int maxMessageSizeBytes = 1_048_576;

    /** Maximum nesting depth of the serialized message, 0 disables the check. */
    private int maxObjectDepth = 10;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public boolean isRequireCorrelationId() { return requireCorrelationId; }
    public void setRequireCorrelationId(boolean requireCorrelationId) { this.requireCorrelationId = requireCorrelationId; }

    public int getMaxMessageAgeDays() { return maxMessageAgeDays; }
    public void setMaxMessageAgeDays(int maxMessageAgeDays) { this.maxMessageAgeDays = maxMessageAgeDays; }

    public boolean isFailOnValidatorException() { return failOnValidatorException; }
    public void setFailOnValidatorException(boolean failOnValidatorException) { this.failOnValidatorException = failOnValidatorException; }

    public boolean isBlockSqlInjection() { return blockSqlInjection; }
    public void setBlockSqlInjection(boolean blockSqlInjection) { this.blockSqlInjection = blockSqlInjection; }

    public boolean isBlockNoSqlInjection() { return blockNoSqlInjection; }
    public void setBlockNoSqlInjection(boolean blockNoSqlInjection) { this.blockNoSqlInjection = blockNoSqlInjection; }

    public boolean isBlockCommandInjection() { return blockCommandInjection; }
    public void setBlockCommandInjection(boolean blockCommandInjection) { this.blockCommandInjection = blockCommandInjection; }

    public boolean isBlockPathTraversal() { return blockPathTraversal; }
    public void setBlockPathTraversal(boolean blockPathTraversal) { this.blockPathTraversal = blockPathTraversal; }

    public boolean isBlockLdapInjection() { return blockLdapInjection; }
    public void setBlockLdapInjection(boolean blockLdapInjection) { this.blockLdapInjection = blockLdapInjection; }

    public boolean isBlockHtmlContent() { return blockHtmlContent; }
    public void setBlockHtmlContent(boolean blockHtmlContent) { this.blockHtmlContent = blockHtmlContent; }

    public boolean isBlockControlCharacters() { return blockControlCharacters; }
    public void setBlockControlCharacters(boolean blockControlCharacters) { this.blockControlCharacters = blockControlCharacters; }

    public int getMaxStringLength() { return maxStringLength; }
    public void setMaxStringLength(int maxStringLength) { this.maxStringLength = maxStringLength; }

    public int getMaxMessageSizeBytes() { return maxMessageSizeBytes; }
    public void setMaxMessageSizeBytes(int maxMessageSizeBytes) { this.maxMessageSizeBytes = maxMessageSizeBytes; }

    public int getMaxObjectDepth() { return maxObjectDepth; }
    public void setMaxObjectDepth(int maxObjectDepth) { this.maxObjectDepth = maxObjectDepth; }
}

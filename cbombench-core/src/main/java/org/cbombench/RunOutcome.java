package org.cbombench;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * Result of one adapter invocation as stored in a {@link RunRecord}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({ @JsonSubTypes.Type(value = RunOutcome.Success.class, name = "success"),
		@JsonSubTypes.Type(value = RunOutcome.Timeout.class, name = "timeout"),
		@JsonSubTypes.Type(value = RunOutcome.ToolError.class, name = "tool_error"),
		@JsonSubTypes.Type(value = RunOutcome.MalformedOutput.class, name = "malformed_output") })
public sealed interface RunOutcome
		permits RunOutcome.Success, RunOutcome.Timeout, RunOutcome.ToolError, RunOutcome.MalformedOutput {

	OutcomeKind kind();

	/**
	 * The tool produced a parsable document, kept verbatim.
	 *
	 * @param document the raw document
	 */
	record Success(JsonNode document) implements RunOutcome {

		@Override
		public OutcomeKind kind() {
			return OutcomeKind.SUCCESS;
		}

	}

	/**
	 * The invocation exceeded its time budget and was cancelled.
	 *
	 * @param timeoutSeconds the budget that was exceeded
	 */
	record Timeout(double timeoutSeconds) implements RunOutcome {

		@Override
		public OutcomeKind kind() {
			return OutcomeKind.TIMEOUT;
		}

	}

	/**
	 * The tool signalled a failure.
	 *
	 * @param message failure description
	 */
	record ToolError(String message) implements RunOutcome {

		@Override
		public OutcomeKind kind() {
			return OutcomeKind.TOOL_ERROR;
		}

	}

	/**
	 * The tool finished but its output could not be used as a document.
	 *
	 * @param message why the output was rejected
	 * @param rawOutput the output as received, when there was any
	 */
	record MalformedOutput(String message, @Nullable String rawOutput) implements RunOutcome {

		@Override
		public OutcomeKind kind() {
			return OutcomeKind.MALFORMED_OUTPUT;
		}

	}

}

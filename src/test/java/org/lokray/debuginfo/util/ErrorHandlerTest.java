package org.lokray.debuginfo.util;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorHandlerTest
{
	@Test
	@Tag("unit")
	void logWarning_shouldCollectFormattedWarning()
	{
		ErrorHandler errorHandler = new ErrorHandler();
		assertThat(errorHandler.hasWarnings()).isFalse();

		errorHandler.logWarning("App.Program", "something is approximate");

		assertThat(errorHandler.hasWarnings()).isTrue();
		assertThat(errorHandler.getWarnings()).containsExactly("[Debug Info] App.Program - something is approximate");
		assertThatThrownBy(() -> errorHandler.getWarnings().clear()).isInstanceOf(UnsupportedOperationException.class);
	}
}

package org.lokray.debuginfo.metadata;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.lokray.debuginfo.model.NativeValue;

import java.util.Objects;

import static org.bytedeco.llvm.global.LLVM.LLVMGetValueName;

/**
 * Wraps an LLVM function or alloca so it can be handed to debug info synthesis.
 */
public class LLVMNativeValue implements NativeValue
{
	private final LLVMValueRef value;

	public LLVMNativeValue(LLVMValueRef value)
	{
		this.value = Objects.requireNonNull(value, "value");
	}

	public LLVMValueRef getValue()
	{
		return value;
	}

	@Override
	public String getName()
	{
		BytePointer name = LLVMGetValueName(value);
		return name == null ? "" : name.getString();
	}
}

package org.lokray.debuginfo.metadata;

import org.bytedeco.llvm.LLVM.LLVMBuilderRef;
import org.bytedeco.llvm.LLVM.LLVMContextRef;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Owns the LLVM context, module and IR builder that code generation and debug
 * info synthesis share.
 */
public class LLVMContext implements AutoCloseable
{
	private final LLVMContextRef context;
	private final LLVMModuleRef module;
	private final LLVMBuilderRef builder;

	public LLVMContext(String moduleName)
	{
		this.context = LLVMContextCreate();
		this.module = LLVMModuleCreateWithNameInContext(moduleName, context);
		this.builder = LLVMCreateBuilderInContext(context);
	}

	public LLVMContextRef getContext()
	{
		return context;
	}

	public LLVMModuleRef getModule()
	{
		return module;
	}

	public LLVMBuilderRef getBuilder()
	{
		return builder;
	}

	@Override
	public void close()
	{
		LLVMDisposeBuilder(builder);
		LLVMDisposeModule(module);
		LLVMContextDispose(context);
	}
}

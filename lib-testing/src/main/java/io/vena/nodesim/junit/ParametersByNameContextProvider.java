package io.vena.nodesim.junit;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.extension.Extension;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.junit.jupiter.api.extension.TestTemplateInvocationContext;
import org.junit.jupiter.api.extension.TestTemplateInvocationContextProvider;
import org.junit.platform.commons.util.ReflectionUtils;

import static java.util.Collections.emptyMap;
import static java.util.Collections.singletonList;
import static java.util.stream.Collectors.toList;

public class ParametersByNameContextProvider implements TestTemplateInvocationContextProvider {

	@Override
	public boolean supportsTestTemplate(ExtensionContext context) {
		return context.getTestMethod().isPresent();
	}

	@Override
	public Stream<TestTemplateInvocationContext> provideTestTemplateInvocationContexts(ExtensionContext context) {
		Class<?> testClass = context.getRequiredTestClass();
		Map<String, List<?>> valueListsByName = new LinkedHashMap<>();
		allParameterNames(context).forEach(name ->
			valueListsByName.put(name, invokeCorrespondingMethod(name, testClass).collect(toList())));
		return cartesianProduct(valueListsByName).map(binding -> new TestTemplateInvocationContext() {
			@Override
			public String getDisplayName(int invocationIndex) {
				return "[" + invocationIndex + "] " + binding;
			}

			@Override
			public List<Extension> getAdditionalExtensions() {
				return singletonList(new ParameterBinder(binding));
			}
		});
	}

	/**
	 * Parameters of an annotated constructor come first, followed by those of the test method.
	 * A name appearing in both is bound once.
	 */
	private static List<String> allParameterNames(ExtensionContext context) {
		List<Parameter> parameters = new ArrayList<>();

		Class<?> testClass = context.getRequiredTestClass();
		List<Constructor<?>> annotatedConstructors = ReflectionUtils.findConstructors(testClass, c -> c.isAnnotationPresent(ParametersByName.class));
		switch (annotatedConstructors.size()) {
			case 0:
				break;
			case 1:
				Collections.addAll(parameters, annotatedConstructors.get(0).getParameters());
				break;
			default:
				throw new ParameterResolutionException("Multiple constructors annotated with " + ParametersByName.class.getSimpleName() + ": " + annotatedConstructors);
		}

		Collections.addAll(parameters, context.getRequiredTestMethod().getParameters());

		return parameters.stream()
			.map(Parameter::getName)
			.distinct()
			.collect(toList());
	}

	/**
	 * The value source may be declared on the test class or any of its superclasses.
	 */
	private static Stream<?> invokeCorrespondingMethod(String name, Class<?> testClass) {
		Method m = ReflectionUtils.getRequiredMethod(testClass, name);
		return (Stream<?>) ReflectionUtils.invokeMethod(m, null);
	}

	private static Stream<Map<String, ?>> cartesianProduct(Map<String, List<?>> valueListsByName) {
		Stream<Map<String, ?>> result = Stream.of(emptyMap());
		for (Map.Entry<String, List<?>> entry: valueListsByName.entrySet()) {
			String name = entry.getKey();
			List<?> values = entry.getValue();
			result = result.flatMap(existing ->
				values.stream().map(newValue -> {
					Map<String, Object> extended = new LinkedHashMap<>(existing);
					extended.put(name, newValue);
					return extended;
				}));
		}
		return result;
	}

	private static final class ParameterBinder implements ParameterResolver {
		private final Map<String, ?> binding;

		ParameterBinder(Map<String, ?> binding) {
			this.binding = binding;
		}

		@Override
		public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
			return binding.containsKey(parameterContext.getParameter().getName());
		}

		@Override
		public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
			return binding.get(parameterContext.getParameter().getName());
		}
	}
}

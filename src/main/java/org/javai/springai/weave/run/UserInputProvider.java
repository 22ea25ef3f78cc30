package org.javai.springai.weave.run;

/**
 * Answers {@code ask} requests on behalf of a user.
 */
@FunctionalInterface
public interface UserInputProvider {

	/**
	 * @param prompt the rendered question
	 * @return the user's answer, never {@code null}
	 */
	String ask(String prompt);
}

/**
 * File system checks used by {@link fr.lapetina.expect.api.path.PathExpect}, delegating to
 * AssertJ's {@link org.assertj.core.api.AbstractPathAssert}.
 */
package fr.lapetina.expect.domain.path;

package com.fhi.dog_shelter.fixtures.annotation;

import java.lang.annotation.*;

/**
 * Declares, on a test class, the entities whose JSON fixtures are loaded into the database
 * before the tests run.
 *
 * <p>Fixtures are loaded in the order given, parents first: {@code Breed} before {@code Dog},
 * since a dog fixture refers to its breed by id.</p>
 *
 * <p>Lookup, for entity {@code Dog} in test class {@code DogControllerTest}:
 * <pre>
 *   fixtures/tests/DogControllerTest/dogs.json   (test specific, if present)
 *   fixtures/shared/dogs.json                    (otherwise)
 * </pre>
 *
 * <p>Used together with {@code @SpringIntegrationTest}, which registers the listener doing the loading
 * and rolls every test back. Fixtures are therefore loaded again before each test method.</p>
 *
 * <pre>{@code
 *    @SpringIntegrationTest
 *    @Fixtures({ Breed.class, Dog.class })
 *    class MyIntegrationTest { ... }
 * }</pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
public @interface Fixtures
{
    /**
     * Entity classes for which fixtures should be loaded.
     */
    Class<?>[] value();
}

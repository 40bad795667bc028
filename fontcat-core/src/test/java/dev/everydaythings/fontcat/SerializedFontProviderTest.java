/*
 * Copyright (C) 2024 fontcat contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.everydaythings.fontcat;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SerializedFontProviderTest {

    @Test
    void holdsLockDuringCall() {
        FakeFontProvider fake = new FakeFontProvider().family("Alpha");
        SerializedFontProvider provider = new SerializedFontProvider(fake);

        boolean held = provider.call(p -> provider.isHeldByCurrentThread());

        assertTrue(held);
        assertFalse(provider.isHeldByCurrentThread());
        assertEquals(List.of("Alpha"), provider.call(PlatformFontProvider::enumerateFamilies));
        assertSame(fake, provider.provider());
    }

    @Test
    void failuresBecomeProviderUnavailable() {
        FakeFontProvider fake = new FakeFontProvider();
        fake.failEnumeration = true;
        SerializedFontProvider provider = new SerializedFontProvider(fake);

        ProviderUnavailableException e = assertThrows(ProviderUnavailableException.class,
                () -> provider.call(PlatformFontProvider::enumerateFamilies));

        assertTrue(e.getCause() instanceof IllegalStateException);
        assertFalse(provider.isHeldByCurrentThread());
    }

    @Test
    void providerUnavailablePassesThrough() {
        ProviderUnavailableException original = new ProviderUnavailableException("offline");
        SerializedFontProvider provider = new SerializedFontProvider(new FakeFontProvider());

        ProviderUnavailableException thrown = assertThrows(ProviderUnavailableException.class,
                () -> provider.call(p -> {
                    throw original;
                }));

        assertSame(original, thrown);
    }

    @Test
    void requiresAProvider() {
        assertThrows(IllegalArgumentException.class, () -> new SerializedFontProvider(null));
    }
}

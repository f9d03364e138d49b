package me.golemcore.proxy.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * One piece of an assembled response. {@code code} is only meaningful for
 * {@link FragmentKind#ERROR} fragments.
 */
public record ResponseFragment(FragmentKind kind, String text, int code) {

    public static ResponseFragment chat(String text) {
        return new ResponseFragment(FragmentKind.CHAT, text, 200);
    }

    public static ResponseFragment proxy(String text) {
        return new ResponseFragment(FragmentKind.PROXY, text, 200);
    }

    public static ResponseFragment error(String text, int code) {
        return new ResponseFragment(FragmentKind.ERROR, text, code);
    }

    public boolean isChat() {
        return kind == FragmentKind.CHAT;
    }

    public boolean isError() {
        return kind == FragmentKind.ERROR;
    }
}

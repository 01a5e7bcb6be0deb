package com.example.lmsreport.llm;

/**
 * LocalLlmClientが使うプロンプト。いずれもJSONのみを返すよう指示する。
 */
final class LlmPrompts {

    private LlmPrompts() {
    }

    static final String COURSE_LIST = """
            The following HTML is the "My courses" page of a learning management system.
            Extract EVERY course listed on the page. For each course return:
            1) "name": the full course name as displayed.
            2) "url": the link to the course page. Relative URLs are relative to %s.

            Answer ONLY with a valid JSON array of objects with exactly the keys "name" and "url".
            Example: [{"name": "LINEAR ALGEBRA - T01 - 2026", "url": "%s/course/view.php?id=3418"}]
            No explanations, no markdown. Only the JSON array.

            HTML:
            %s
            """;

    static final String COURSE_PAGE = """
            Decide whether the following HTML is the main page of a single course in a learning
            management system (a page listing the course sections, resources and activities).
            Page URL: %s

            Answer ONLY with a valid JSON object: {"is_course": true|false, "course_name": "..."}
            Use an empty course_name when is_course is false. No explanations, no markdown.

            HTML:
            %s
            """;

    static final String ASSIGNMENTS = """
            The following HTML is the page of the course "%s" (%s) in a learning management system.
            Extract every gradable activity (assignments, quizzes, forums, workshops) shown on the page.
            For each activity return:
            - "title": the activity name as displayed
            - "due_date": the due date text exactly as shown, or "" if none is shown
            - "url": the link to the activity
            - "type": one of assignment, quiz, forum, workshop, activity

            Answer ONLY with a valid JSON array of objects with exactly those four keys.
            No explanations, no markdown. Only the JSON array.

            HTML:
            %s
            """;
}
